package com.shlawgathon.faceguard.backend.index;

/**
 * Thrown when a vector's length does not match the index dimension.
 */
public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Vector dimension " + actual + " does not match index dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
