package com.facefinder.common.exception;

/**
 * A persisted index snapshot cannot be used. Recovered by rebuilding from the store.
 */
public class CorruptIndexException extends FaceFinderException {

    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
