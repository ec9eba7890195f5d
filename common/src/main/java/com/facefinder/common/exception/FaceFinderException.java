package com.facefinder.common.exception;

/**
 * Root of the face finder error hierarchy.
 */
public class FaceFinderException extends RuntimeException {

    public FaceFinderException(String message) {
        super(message);
    }

    public FaceFinderException(String message, Throwable cause) {
        super(message, cause);
    }
}
