package com.facefinder.main.session;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference face of one guest together with the queries asked against it.
 */
@Getter
public class SearchSession {

    private final String sessionId;
    private final String roomId;
    private final float[] referenceEmbedding;
    private final Instant createdAt;
    private final List<QueryLogEntry> queryLog = new ArrayList<>();

    public SearchSession(String sessionId, String roomId, float[] referenceEmbedding, Instant createdAt) {
        this.sessionId = sessionId;
        this.roomId = roomId;
        this.referenceEmbedding = referenceEmbedding.clone();
        this.createdAt = createdAt;
    }

    public float[] getReferenceEmbedding() {
        return referenceEmbedding.clone();
    }

    public synchronized void appendQuery(QueryLogEntry entry) {
        queryLog.add(entry);
    }

    public synchronized List<QueryLogEntry> getQueryLog() {
        return List.copyOf(queryLog);
    }

    /** One query and the summary returned for it */
    public record QueryLogEntry(String queryText, String responseSummary, Instant at) {
    }
}
