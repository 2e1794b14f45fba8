package com.example.resumeindex;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(QueryController.class);

    private final QueryResolver resolver;

    public QueryController(QueryResolver resolver) {
        this.resolver = resolver;
    }

    @PostMapping
    public QueryModels.QueryResponse queryByVector(@RequestBody QueryModels.VectorQueryRequest req) {
        requirePositiveTopK(req.getTopK());
        Path artifact = resolver.artifactPath(req.getArtifactPath());
        log.info("Vector query: dim={} topK={} artifact={}", req.getVector() == null ? 0 : req.getVector().length, req.getTopK(), artifact);
        List<QueryModels.Neighbor> neighbors = resolver.resolve(req.getVector(), artifact, req.getTopK(), req.isResolveRecords());
        return response(artifact, req.getTopK(), neighbors);
    }

    @PostMapping("/profile")
    public QueryModels.QueryResponse queryByProfile(@RequestBody QueryModels.ProfileQueryRequest req) {
        requirePositiveTopK(req.getTopK());
        Path artifact = resolver.artifactPath(req.getArtifactPath());
        log.info("Profile query: topK={} artifact={}", req.getTopK(), artifact);
        List<QueryModels.Neighbor> neighbors = resolver.resolveProfile(req.getProfile(), artifact.toString(), req.getTopK(), req.getModel());
        return response(artifact, req.getTopK(), neighbors);
    }

    // checked before the artifact is resolved so a bad top_k wins over a missing index
    private static void requirePositiveTopK(int topK) {
        if (topK <= 0) {
            throw new ConfigurationException("top_k must be greater than 0, got " + topK + ".");
        }
    }

    private QueryModels.QueryResponse response(Path artifact, int topK, List<QueryModels.Neighbor> neighbors) {
        QueryModels.QueryResponse resp = new QueryModels.QueryResponse();
        resp.setArtifactPath(IndexArtifactStore.reference(artifact));
        resp.setRequestedTopK(topK);
        resp.setNeighbors(neighbors);
        return resp;
    }
}
