package com.example.resumeindex;

/**
 * Raised when a query vector's length differs from the dimension of the index it is searched against.
 */
public class DimensionMismatchException extends ResumeIndexException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: query has " + actual + ", index expects " + expected + ".",
                null, ErrorCode.DIMENSION_MISMATCH);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() { return expected; }

    public int getActual() { return actual; }
}
