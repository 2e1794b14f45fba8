package com.example.resumeindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns an ordered list of texts into an ordered list of vectors, one per text.
 * <p>
 * Texts are sent in consecutive chunks of at most {@code batchSize}, strictly one chunk at a time.
 * A provider may reorder results inside a chunk, so each chunk is re-sorted by the returned index
 * before it is appended.
 */
@Service
public class EmbeddingGenerator {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGenerator.class);

    private final EmbeddingProvider provider;

    public EmbeddingGenerator(EmbeddingProvider provider) {
        this.provider = provider;
    }

    public List<float[]> embed(List<String> texts, String model, int batchSize) {
        if (batchSize <= 0) {
            throw new ConfigurationException("batch_size must be greater than 0, got " + batchSize + ".");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("Embedding model must be a non-empty string.");
        }
        List<float[]> out = new ArrayList<>(texts.size());
        if (texts.isEmpty()) return out;

        int chunks = (texts.size() + batchSize - 1) / batchSize;
        for (int start = 0, chunk = 0; start < texts.size(); start += batchSize, chunk++) {
            int end = Math.min(start + batchSize, texts.size());
            List<String> batch = texts.subList(start, end);
            log.debug("Embedding chunk {}/{} (texts {}..{}) with model {}", chunk + 1, chunks, start, end - 1, model);

            List<EmbeddingProvider.EmbeddingResult> results;
            try {
                results = provider.embedBatch(batch, model);
            } catch (ResumeIndexException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UpstreamException("Embedding provider failed on chunk " + (chunk + 1) + "/" + chunks
                        + " (texts " + start + ".." + (end - 1) + "): " + e.getMessage(), e);
            }
            if (results == null) {
                throw new UpstreamException("Embedding provider returned no data for chunk " + (chunk + 1) + "/" + chunks + ".");
            }
            if (results.size() != batch.size()) {
                throw new UpstreamException("Embedding provider returned " + results.size() + " result(s) for chunk "
                        + (chunk + 1) + "/" + chunks + " (texts " + start + ".." + (end - 1) + "); expected " + batch.size() + ".");
            }
            List<EmbeddingProvider.EmbeddingResult> sorted = new ArrayList<>(results);
            sorted.sort(Comparator.comparingInt(EmbeddingProvider.EmbeddingResult::getIndex));
            // indices must be exactly 0..n-1, otherwise vectors would land on the wrong texts
            for (int j = 0; j < sorted.size(); j++) {
                if (sorted.get(j).getIndex() != j) {
                    throw new UpstreamException("Embedding provider returned indices that are not 0.." + (batch.size() - 1)
                            + " for chunk " + (chunk + 1) + "/" + chunks + " (texts " + start + ".." + (end - 1) + ").");
                }
                out.add(sorted.get(j).getVector());
            }
        }

        if (out.size() != texts.size()) {
            throw new UpstreamException("Embedding count did not match flattened row count: expected "
                    + texts.size() + ", got " + out.size() + ".");
        }
        log.info("Generated {} embeddings in {} chunk(s) with model {}", out.size(), chunks, model);
        return out;
    }
}
