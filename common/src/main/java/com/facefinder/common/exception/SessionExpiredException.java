package com.facefinder.common.exception;

import lombok.Getter;

@Getter
public class SessionExpiredException extends FaceFinderException {

    private final String sessionId;

    public SessionExpiredException(String sessionId) {
        super("Session expired or unknown: " + sessionId + ". Upload a reference face again.");
        this.sessionId = sessionId;
    }
}
