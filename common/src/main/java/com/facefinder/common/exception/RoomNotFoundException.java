package com.facefinder.common.exception;

import lombok.Getter;

@Getter
public class RoomNotFoundException extends FaceFinderException {

    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
        this.roomId = roomId;
    }
}
