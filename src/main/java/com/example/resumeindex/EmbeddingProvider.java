package com.example.resumeindex;

import java.util.List;

/**
 * One call to an external embedding model. Implementations may return the results of a batch in any
 * order, but each result must carry the position of its input text within that batch.
 */
public interface EmbeddingProvider {

    List<EmbeddingResult> embedBatch(List<String> texts, String model);

    class EmbeddingResult {
        private final int index;
        private final float[] vector;

        public EmbeddingResult(int index, float[] vector) {
            this.index = index;
            this.vector = vector;
        }

        public int getIndex() { return index; }
        public float[] getVector() { return vector; }
    }
}
