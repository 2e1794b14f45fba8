package com.example.resumeindex;

import com.github.jelmerk.knn.Item;

import java.io.Serializable;

/**
 * Index entry keyed by its 0-based position in the batch it was built from.
 */
class PositionItem implements Item<Integer, float[]>, Serializable {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final float[] vector;

    PositionItem(int position, float[] vector) {
        this.position = position;
        this.vector = vector;
    }

    @Override
    public Integer id() { return position; }

    @Override
    public float[] vector() { return vector; }

    @Override
    public int dimensions() { return vector != null ? vector.length : 0; }

    @Override
    public long version() { return 0L; }
}
