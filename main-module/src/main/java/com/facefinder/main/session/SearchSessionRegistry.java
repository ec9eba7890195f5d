package com.facefinder.main.session;

import com.facefinder.common.exception.SessionExpiredException;
import com.facefinder.main.config.SessionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр сессий поиска. Сессия истекает через idleTimeout после создания;
 * истёкшие сессии удаляются при обращении и, если включено, фоновой очисткой.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchSessionRegistry {

    private final SessionProperties properties;
    private final Clock clock;

    private final Map<String, SearchSession> sessions = new ConcurrentHashMap<>();

    public SearchSession create(String roomId, float[] referenceEmbedding) {
        String sessionId = UUID.randomUUID().toString();
        SearchSession session = new SearchSession(sessionId, roomId, referenceEmbedding, clock.instant());
        sessions.put(sessionId, session);
        log.info("Created search session {} in room {}", sessionId, roomId);
        return session;
    }

    /**
     * @return empty for an unknown or expired session
     */
    public Optional<SearchSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        SearchSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session, clock.instant())) {
            sessions.remove(sessionId, session);
            log.info("Search session {} expired", sessionId);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * @throws SessionExpiredException for an unknown or expired session
     */
    public SearchSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new SessionExpiredException(sessionId));
    }

    /** Ничего не делает, если сессии уже нет */
    public void appendQuery(String sessionId, String queryText, String summary) {
        get(sessionId).ifPresent(session ->
            session.appendQuery(new SearchSession.QueryLogEntry(queryText, summary, clock.instant())));
    }

    public boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${face-finder.session.sweep-interval:PT5M}")
    public void sweep() {
        if (!properties.isSweepEnabled()) {
            return;
        }
        int removed = sweepExpired();
        if (removed > 0) {
            log.info("Removed {} expired search sessions", removed);
        }
    }

    int sweepExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(session -> isExpired(session, now));
        return before - sessions.size();
    }

    private boolean isExpired(SearchSession session, Instant now) {
        return Duration.between(session.getCreatedAt(), now).compareTo(properties.getIdleTimeout()) > 0;
    }
}
