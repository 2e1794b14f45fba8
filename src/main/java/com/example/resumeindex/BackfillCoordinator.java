package com.example.resumeindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds the selected profiles into one new shared artifact and points each of them at it.
 * <p>
 * All or nothing per call: rows are attached only after the artifact is on disk, so any earlier
 * failure leaves the store exactly as it was. Concurrent backfills on one store are not supported.
 */
@Slf4j
@Service
public class BackfillCoordinator {

    private final ProfileStore store;
    private final ProfileFlattener flattener;
    private final EmbeddingGenerator embeddingGenerator;
    private final IndexBuilder indexBuilder;

    public BackfillCoordinator(ProfileStore store,
                               ProfileFlattener flattener,
                               EmbeddingGenerator embeddingGenerator,
                               IndexBuilder indexBuilder) {
        this.store = store;
        this.flattener = flattener;
        this.embeddingGenerator = embeddingGenerator;
        this.indexBuilder = indexBuilder;
    }

    public BackfillSummary backfill(BackfillMode mode, String model, int batchSize) {
        if (batchSize <= 0) {
            throw new ConfigurationException("batch_size must be greater than 0, got " + batchSize + ".");
        }
        List<ResumeProfileRecord> selected = store.selectForBackfill(mode);
        log.info("Backfill mode={} selected {} row(s)", mode.label(), selected.size());
        if (selected.isEmpty()) {
            return BackfillSummary.empty(mode);
        }

        List<Long> ids = new ArrayList<>(selected.size());
        List<String> texts = new ArrayList<>(selected.size());
        for (ResumeProfileRecord r : selected) {
            String text;
            try {
                text = flattener.flatten(r.getProfileJson());
            } catch (ValidationException e) {
                throw new ValidationException("Row " + r.getId() + " (" + r.getExternalId() + ") has invalid profile_json: " + e.getMessage(), e);
            }
            if (text.isBlank()) {
                throw new ValidationException("Row " + r.getId() + " (" + r.getExternalId() + ") produced empty flattened resume text.");
            }
            ids.add(r.getId());
            texts.add(text);
        }

        List<float[]> vectors = embeddingGenerator.embed(texts, model, batchSize);
        Path artifact = indexBuilder.build(vectors);
        String ref = IndexArtifactStore.reference(artifact);
        int processed = store.attachIndexArtifact(ids, ref);

        BackfillSummary summary = BackfillSummary.empty(mode);
        summary.setSelectedCount(selected.size());
        summary.setPendingCount(selected.size());
        summary.setProcessedCount(processed);
        summary.setArtifactPath(ref);
        summary.setUpdatedIds(ids);
        log.info("Backfill mode={} finished: processed={} artifact={}", mode.label(), processed, ref);
        return summary;
    }
}
