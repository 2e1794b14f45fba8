package com.example.resumeindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one backfill at startup when launched with {@code --backfill.run=true}, e.g.
 * {@code --backfill.mode=missing --embedding.batch-size=16}.
 */
@Component
@ConditionalOnProperty(name = "backfill.run", havingValue = "true")
public class BackfillRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BackfillRunner.class);

    private final BackfillCoordinator coordinator;
    private final IndexArtifactStore artifacts;
    private final String mode;
    private final String model;
    private final int batchSize;

    public BackfillRunner(BackfillCoordinator coordinator,
                          IndexArtifactStore artifacts,
                          @Value("${backfill.mode:full}") String mode,
                          @Value("${embedding.model:text-embedding-3-large}") String model,
                          @Value("${embedding.batch-size:32}") int batchSize) {
        this.coordinator = coordinator;
        this.artifacts = artifacts;
        this.mode = mode;
        this.model = model;
        this.batchSize = batchSize;
    }

    @Override
    public void run(String... args) {
        BackfillMode parsed = BackfillMode.parse(mode);
        log.info("BackfillRunner: starting mode={} model={} batchSize={} indexDir={}",
                parsed.label(), model, batchSize, artifacts.getIndexDir());

        BackfillSummary summary = coordinator.backfill(parsed, model, batchSize);

        log.info("BackfillRunner: rows selected={} rows updated={}", summary.getSelectedCount(), summary.getProcessedCount());
        if (summary.getArtifactPath() != null) {
            log.info("BackfillRunner: shared index artifact {}", summary.getArtifactPath());
        } else {
            log.info("BackfillRunner: no index artifact generated (no rows selected)");
        }
    }
}
