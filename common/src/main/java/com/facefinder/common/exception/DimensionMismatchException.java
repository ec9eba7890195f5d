package com.facefinder.common.exception;

import lombok.Getter;

/**
 * Thrown when a vector does not have the dimension of the room it is written to or searched in.
 * Vectors are never truncated or padded.
 */
@Getter
public class DimensionMismatchException extends FaceFinderException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Vector dimension mismatch. Expected: %d, got: %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
