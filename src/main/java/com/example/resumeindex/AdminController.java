package com.example.resumeindex;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/index")
public class AdminController {

    private final BackfillCoordinator coordinator;
    private final IndexArtifactStore artifacts;
    private final ProfileStore store;
    private final String defaultModel;
    private final int defaultBatchSize;

    public AdminController(BackfillCoordinator coordinator,
                           IndexArtifactStore artifacts,
                           ProfileStore store,
                           @Value("${embedding.model:text-embedding-3-large}") String defaultModel,
                           @Value("${embedding.batch-size:32}") int defaultBatchSize) {
        this.coordinator = coordinator;
        this.artifacts = artifacts;
        this.store = store;
        this.defaultModel = defaultModel;
        this.defaultBatchSize = defaultBatchSize;
    }

    @PostMapping("/backfill")
    public BackfillSummary backfill(@RequestParam(name = "mode", defaultValue = "full") String mode,
                                    @RequestParam(name = "model", required = false) String model,
                                    @RequestParam(name = "batchSize", required = false) Integer batchSize) {
        return coordinator.backfill(BackfillMode.parse(mode),
                model == null || model.isBlank() ? defaultModel : model,
                batchSize == null ? defaultBatchSize : batchSize);
    }

    @GetMapping("/artifacts")
    public List<String> listArtifacts() {
        return artifacts.listArtifacts().stream()
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> out = new HashMap<>();
        out.put("records", store.count());
        out.put("pending", store.countPending());
        out.put("indexDir", artifacts.getIndexDir().toString());
        List<Path> all = artifacts.listArtifacts();
        out.put("latestArtifact", all.isEmpty() ? null : IndexArtifactStore.reference(all.get(all.size() - 1)));
        return out;
    }
}
