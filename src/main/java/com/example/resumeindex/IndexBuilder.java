package com.example.resumeindex;

import com.github.jelmerk.knn.bruteforce.BruteForceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds one exhaustive-search index from a batch of vectors and writes it as a new artifact.
 * The vector at input position {@code i} is stored under id {@code i}.
 */
@Service
public class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final IndexArtifactStore artifacts;

    public IndexBuilder(IndexArtifactStore artifacts) {
        this.artifacts = artifacts;
    }

    public Path build(List<float[]> vectors) {
        int dim = validate(vectors);
        BruteForceIndex<Integer, float[], PositionItem, Float> index =
                BruteForceIndex.newBuilder(dim, SquaredL2Distance.INSTANCE).build();
        for (int i = 0; i < vectors.size(); i++) {
            index.add(new PositionItem(i, vectors.get(i).clone()));
        }
        log.info("Built exhaustive L2 index: {} vectors, dimension {}", index.size(), dim);
        return artifacts.write(index);
    }

    static int validate(List<float[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new ValidationException("No embeddings provided; cannot build index.");
        }
        float[] first = vectors.get(0);
        int dim = first == null ? 0 : first.length;
        if (dim == 0) {
            throw new ValidationException("Embedding vector size cannot be zero.");
        }
        for (int i = 0; i < vectors.size(); i++) {
            float[] v = vectors.get(i);
            int len = v == null ? 0 : v.length;
            if (len != dim) {
                throw new ValidationException("Embedding at position " + i + " has dimension " + len + "; expected " + dim + ".");
            }
        }
        return dim;
    }
}
