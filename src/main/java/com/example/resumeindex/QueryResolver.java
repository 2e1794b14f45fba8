package com.example.resumeindex;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.jelmerk.knn.SearchResult;
import com.github.jelmerk.knn.bruteforce.BruteForceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Exhaustive nearest-neighbor search over one index artifact, with index positions mapped back to
 * stored profiles.
 */
@Service
public class QueryResolver {

    private static final Logger log = LoggerFactory.getLogger(QueryResolver.class);

    private static final Comparator<SearchResult<PositionItem, Float>> BY_DISTANCE_THEN_POSITION =
            Comparator.<SearchResult<PositionItem, Float>, Float>comparing(SearchResult::distance)
                    .thenComparing(r -> r.item().id());

    private final IndexArtifactStore artifacts;
    private final ProfileStore store;
    private final ProfileFlattener flattener;
    private final ResumeProfileReader reader;
    private final EmbeddingGenerator embeddingGenerator;
    private final String defaultModel;

    public QueryResolver(IndexArtifactStore artifacts,
                         ProfileStore store,
                         ProfileFlattener flattener,
                         ResumeProfileReader reader,
                         EmbeddingGenerator embeddingGenerator,
                         @Value("${embedding.model:text-embedding-3-large}") String defaultModel) {
        this.artifacts = artifacts;
        this.store = store;
        this.flattener = flattener;
        this.reader = reader;
        this.embeddingGenerator = embeddingGenerator;
        this.defaultModel = defaultModel;
    }

    /**
     * @param joinRecords when false, only geometric results are returned and the store is not consulted
     * @return up to {@code min(topK, artifact size)} neighbors, ascending by distance, ties by lower position
     */
    public List<QueryModels.Neighbor> resolve(float[] query, Path artifact, int topK, boolean joinRecords) {
        if (topK <= 0) {
            throw new ConfigurationException("top_k must be greater than 0, got " + topK + ".");
        }
        if (query == null) {
            throw new ValidationException("Query vector is missing.");
        }
        BruteForceIndex<Integer, float[], PositionItem, Float> index = artifacts.load(artifact);
        int size = index.size();
        if (size <= 0) {
            throw new NotFoundException("Index artifact is empty: " + artifact);
        }
        int dim = index.items().iterator().next().dimensions();
        if (query.length != dim) {
            throw new DimensionMismatchException(dim, query.length);
        }
        int effectiveK = Math.min(topK, size);

        // every item is scored; the library's heap order is not stable on ties, so sort again
        List<SearchResult<PositionItem, Float>> scored = new ArrayList<>(index.findNearest(query, size));
        scored.sort(BY_DISTANCE_THEN_POSITION);

        List<ProfileStore.IndexedRow> mapped = joinRecords
                ? store.lookupByArtifact(IndexArtifactStore.reference(artifact))
                : Collections.emptyList();

        List<QueryModels.Neighbor> out = new ArrayList<>(effectiveK);
        for (int i = 0; i < effectiveK; i++) {
            SearchResult<PositionItem, Float> r = scored.get(i);
            int position = r.item().id();
            QueryModels.Neighbor n = new QueryModels.Neighbor();
            n.setRank(i + 1);
            n.setDistance(r.distance());
            n.setIndexPosition(position);
            if (position >= 0 && position < mapped.size()) {
                ProfileStore.IndexedRow row = mapped.get(position);
                n.setId(row.getId());
                n.setExternalId(row.getExternalId());
                n.setDisplayName(row.getDisplayName());
            }
            out.add(n);
        }
        if (joinRecords && mapped.size() != size) {
            log.warn("Artifact {} holds {} vectors but {} store rows reference it; unmapped positions are returned unresolved",
                    artifact, size, mapped.size());
        }
        log.info("Resolved {} neighbor(s) (requested {}) from {}", out.size(), topK, artifact);
        return out;
    }

    /**
     * Flattens and embeds a raw profile, then searches with the resulting vector.
     *
     * @param artifactPath artifact to search, or null for the newest artifact in the index directory
     * @param model embedding model, or null for the configured default
     */
    public List<QueryModels.Neighbor> resolveProfile(JsonNode profileJson, String artifactPath, int topK, String model) {
        if (topK <= 0) {
            throw new ConfigurationException("top_k must be greater than 0, got " + topK + ".");
        }
        String text = flattener.flatten(reader.read(profileJson));
        if (text.isBlank()) {
            throw new ValidationException("Flattened resume profile is empty.");
        }
        String useModel = model == null || model.isBlank() ? defaultModel : model;
        float[] vector = embeddingGenerator.embed(List.of(text), useModel, 1).get(0);
        return resolve(vector, artifactPath(artifactPath), topK, true);
    }

    public Path artifactPath(String artifactPath) {
        if (artifactPath == null || artifactPath.isBlank()) {
            return artifacts.latest();
        }
        return Path.of(artifactPath.trim());
    }
}
