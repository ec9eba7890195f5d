package com.facefinder.main.dto;

import com.facefinder.main.session.SearchSession;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

@Schema(description = "Search session without its reference embedding")
public record SessionResponse(
    String sessionId,
    String roomId,
    Instant createdAt,
    List<SearchSession.QueryLogEntry> queryLog
) {
    public static SessionResponse from(SearchSession session) {
        return new SessionResponse(session.getSessionId(), session.getRoomId(),
            session.getCreatedAt(), session.getQueryLog());
    }
}
