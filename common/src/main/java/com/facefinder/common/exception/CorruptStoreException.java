package com.facefinder.common.exception;

/**
 * The authoritative embedding store cannot be read. Not recoverable locally.
 */
public class CorruptStoreException extends FaceFinderException {

    public CorruptStoreException(String message) {
        super(message);
    }

    public CorruptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
