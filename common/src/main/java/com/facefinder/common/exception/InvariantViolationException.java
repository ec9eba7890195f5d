package com.facefinder.common.exception;

import lombok.Getter;

/**
 * Index and store disagree on the number of active faces.
 */
@Getter
public class InvariantViolationException extends FaceFinderException {

    private final String roomId;
    private final long storeCount;
    private final long indexCount;

    public InvariantViolationException(String roomId, long storeCount, long indexCount) {
        super(String.format("Index of room %s holds %d active faces, store holds %d",
            roomId, indexCount, storeCount));
        this.roomId = roomId;
        this.storeCount = storeCount;
        this.indexCount = indexCount;
    }
}
