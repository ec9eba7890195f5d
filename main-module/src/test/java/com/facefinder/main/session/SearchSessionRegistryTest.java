package com.facefinder.main.session;

import com.facefinder.common.exception.SessionExpiredException;
import com.facefinder.main.config.SessionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchSessionRegistryTest {

    private MutableClock clock;
    private SessionProperties properties;
    private SearchSessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        properties = new SessionProperties();
        properties.setIdleTimeout(Duration.ofMinutes(30));
        registry = new SearchSessionRegistry(properties, clock);
    }

    @Test
    void sessionIsAvailableUntilTimeout() {
        SearchSession session = registry.create("room", new float[]{1, 0, 0, 0});

        clock.advance(Duration.ofMinutes(30));

        assertThat(registry.get(session.getSessionId())).containsSame(session);
        assertThat(session.getCreatedAt()).isEqualTo(Instant.parse("2024-06-01T12:00:00Z"));
    }

    @Test
    void expiredSessionStaysGone() {
        SearchSession session = registry.create("room", new float[]{1, 0, 0, 0});

        clock.advance(Duration.ofMinutes(31));

        assertThat(registry.get(session.getSessionId())).isEmpty();
        assertThat(registry.get(session.getSessionId())).isEmpty();
        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.require(session.getSessionId()))
            .isInstanceOf(SessionExpiredException.class)
            .hasMessageContaining(session.getSessionId());
    }

    @Test
    void queriesDoNotExtendLifetime() {
        SearchSession session = registry.create("room", new float[]{1, 0, 0, 0});

        clock.advance(Duration.ofMinutes(20));
        registry.appendQuery(session.getSessionId(), "photos from Paris", "Found 2 photos from Paris");
        clock.advance(Duration.ofMinutes(15));

        assertThat(registry.get(session.getSessionId())).isEmpty();
        assertThat(session.getQueryLog()).singleElement()
            .satisfies(entry -> {
                assertThat(entry.queryText()).isEqualTo("photos from Paris");
                assertThat(entry.at()).isEqualTo(Instant.parse("2024-06-01T12:20:00Z"));
            });
    }

    @Test
    void unknownSessionIsTreatedAsExpired() {
        assertThat(registry.get("nope")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("nope")).isInstanceOf(SessionExpiredException.class);
        registry.appendQuery("nope", "ignored", "ignored");
    }

    @Test
    void referenceEmbeddingIsCopied() {
        float[] reference = {1, 0, 0, 0};
        SearchSession session = registry.create("room", reference);

        reference[0] = 9;
        session.getReferenceEmbedding()[1] = 9;

        assertThat(session.getReferenceEmbedding()).containsExactly(1, 0, 0, 0);
    }

    @Test
    void sweepRemovesOnlyExpiredSessions() {
        SearchSession old = registry.create("room", new float[]{1, 0, 0, 0});
        clock.advance(Duration.ofMinutes(20));
        SearchSession fresh = registry.create("room", new float[]{0, 1, 0, 0});
        clock.advance(Duration.ofMinutes(15));

        assertThat(registry.sweepExpired()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.get(fresh.getSessionId())).isPresent();
        assertThat(registry.get(old.getSessionId())).isEmpty();
    }

    @Test
    void scheduledSweepHonoursSwitch() {
        registry.create("room", new float[]{1, 0, 0, 0});
        clock.advance(Duration.ofHours(1));

        registry.sweep();
        assertThat(registry.size()).isEqualTo(1);

        properties.setSweepEnabled(true);
        registry.sweep();
        assertThat(registry.size()).isZero();
    }

    @Test
    void removeDropsSession() {
        SearchSession session = registry.create("room", new float[]{1, 0, 0, 0});

        assertThat(registry.remove(session.getSessionId())).isTrue();
        assertThat(registry.remove(session.getSessionId())).isFalse();
    }
}
