package com.example.resumeindex;

import com.github.jelmerk.knn.DistanceFunction;

/**
 * Squared Euclidean distance, the metric reported by flat L2 indexes. Identical vectors score 0.
 */
class SquaredL2Distance implements DistanceFunction<float[], Float> {

    private static final long serialVersionUID = 1L;

    static final SquaredL2Distance INSTANCE = new SquaredL2Distance();

    @Override
    public Float distance(float[] u, float[] v) {
        float sum = 0f;
        for (int i = 0; i < u.length; i++) {
            float d = u[i] - v[i];
            sum += d * d;
        }
        return sum;
    }
}
