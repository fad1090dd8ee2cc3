package com.syntegra.assessment.modules.session;

import com.syntegra.assessment.PostgresRepositoryTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TestSessionRepository against PostgreSQL")
class TestSessionRepositoryTest extends PostgresRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Autowired private TestSessionRepository sessionRepository;
    @Autowired private TestEntityManager entityManager;

    private TestSession session(SessionStatus status, Instant start, Instant end, boolean autoExpire) {
        return entityManager.persistAndFlush(TestSession.builder()
                .sessionCode("S-" + UUID.randomUUID().toString().substring(0, 8))
                .sessionName("Graduate intake")
                .startTime(start)
                .endTime(end)
                .status(status)
                .autoExpire(autoExpire)
                .build());
    }

    private SessionStatus statusOf(TestSession session) {
        entityManager.clear();
        return sessionRepository.findById(session.getId()).orElseThrow().getStatus();
    }

    @Test
    @DisplayName("expireOverdue expires past active sessions but leaves those without auto-expire")
    void expireSkipsManualSessions() {
        TestSession auto = session(SessionStatus.ACTIVE, NOW.minus(Duration.ofHours(3)),
                NOW.minus(Duration.ofHours(1)), true);
        TestSession manual = session(SessionStatus.ACTIVE, NOW.minus(Duration.ofHours(3)),
                NOW.minus(Duration.ofHours(1)), false);
        TestSession running = session(SessionStatus.ACTIVE, NOW.minus(Duration.ofHours(1)),
                NOW.plus(Duration.ofHours(1)), true);

        int expired = sessionRepository.expireOverdue(NOW, SessionStatus.ACTIVE, SessionStatus.EXPIRED);

        assertThat(expired).isEqualTo(1);
        assertThat(statusOf(auto)).isEqualTo(SessionStatus.EXPIRED);
        assertThat(statusOf(manual)).isEqualTo(SessionStatus.ACTIVE);
        assertThat(statusOf(running)).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("activateDue activates drafts whose window contains now")
    void activateDue() {
        TestSession due = session(SessionStatus.DRAFT, NOW.minus(Duration.ofMinutes(5)),
                NOW.plus(Duration.ofHours(2)), true);
        TestSession future = session(SessionStatus.DRAFT, NOW.plus(Duration.ofHours(1)),
                NOW.plus(Duration.ofHours(2)), true);
        TestSession cancelled = session(SessionStatus.CANCELLED, NOW.minus(Duration.ofMinutes(5)),
                NOW.plus(Duration.ofHours(2)), true);

        int activated = sessionRepository.activateDue(NOW, SessionStatus.DRAFT, SessionStatus.ACTIVE);

        assertThat(activated).isEqualTo(1);
        assertThat(statusOf(due)).isEqualTo(SessionStatus.ACTIVE);
        assertThat(statusOf(future)).isEqualTo(SessionStatus.DRAFT);
        assertThat(statusOf(cancelled)).isEqualTo(SessionStatus.CANCELLED);
    }
}
