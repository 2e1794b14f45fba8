package com.example.resumeindex;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@ConditionalOnProperty(name = "embedding.provider", havingValue = "simple", matchIfMissing = true)
public class SimpleEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public SimpleEmbeddingProvider(@Value("${embedding.simple.dimension:64}") int dimension) {
        if (dimension <= 0) {
            throw new ConfigurationException("embedding.simple.dimension must be greater than 0.");
        }
        this.dimension = dimension;
    }

    // deterministic stub: hash each text into a fixed-size vector, model is ignored
    @Override
    public List<EmbeddingResult> embedBatch(List<String> texts, String model) {
        List<EmbeddingResult> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            out.add(new EmbeddingResult(i, embed(texts.get(i))));
        }
        return out;
    }

    float[] embed(String text) {
        float[] v = new float[dimension];
        int h = text == null ? 0 : text.hashCode();
        for (int i = 0; i < dimension; i++) {
            h = 31 * h + i;
            v[i] = (Math.floorMod(h, 1000) - 500) / 500.0f; // pseudo values in [-1,1]
        }
        return v;
    }
}
