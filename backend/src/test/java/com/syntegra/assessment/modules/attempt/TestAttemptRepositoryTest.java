package com.syntegra.assessment.modules.attempt;

import com.syntegra.assessment.PostgresRepositoryTest;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.ModuleType;
import com.syntegra.assessment.modules.catalog.TestCategory;
import com.syntegra.assessment.modules.session.TestSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TestAttemptRepository against PostgreSQL")
class TestAttemptRepositoryTest extends PostgresRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");

    @Autowired private TestAttemptRepository attemptRepository;
    @Autowired private TestEntityManager entityManager;

    private AssessmentTest test;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        test = entityManager.persistAndFlush(AssessmentTest.builder()
                .name("Verbal reasoning")
                .moduleType(ModuleType.COGNITIVE)
                .category(TestCategory.IQ)
                .timeLimit(30)
                .totalQuestions(20)
                .build());
    }

    private TestAttempt attempt(AttemptStatus status, UUID sessionId) {
        return TestAttempt.builder()
                .userId(userId)
                .testId(test.getId())
                .sessionId(sessionId)
                .startTime(T0)
                .endTime(T0.plus(Duration.ofMinutes(30)))
                .status(status)
                .totalQuestions(20)
                .build();
    }

    private TestAttempt reload(UUID id) {
        entityManager.clear();
        return attemptRepository.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("expireIfOverdue flips an open attempt once its end time has passed")
    void expiresOverdue() {
        TestAttempt open = attemptRepository.saveAndFlush(attempt(AttemptStatus.IN_PROGRESS, null));
        Instant now = T0.plus(Duration.ofMinutes(31));

        int updated = attemptRepository.expireIfOverdue(open.getId(), now, AttemptStatus.openStatuses(),
                AttemptStatus.EXPIRED);

        TestAttempt reloaded = reload(open.getId());
        assertThat(updated).isEqualTo(1);
        assertThat(reloaded.getStatus()).isEqualTo(AttemptStatus.EXPIRED);
        assertThat(reloaded.getActualEndTime()).isEqualTo(now);
        assertThat(reloaded.getVersion()).isEqualTo(open.getVersion() + 1);
    }

    @Test
    @DisplayName("expireIfOverdue leaves attempts inside their window and terminal attempts alone")
    void leavesLiveAndTerminalAttempts() {
        TestAttempt live = attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));
        TestAttempt done = attemptRepository.saveAndFlush(attempt(AttemptStatus.COMPLETED, null));

        assertThat(attemptRepository.expireIfOverdue(live.getId(), T0.plus(Duration.ofMinutes(29)),
                AttemptStatus.openStatuses(), AttemptStatus.EXPIRED)).isZero();
        assertThat(attemptRepository.expireIfOverdue(done.getId(), T0.plus(Duration.ofHours(2)),
                AttemptStatus.openStatuses(), AttemptStatus.EXPIRED)).isZero();
        assertThat(reload(done.getId()).getStatus()).isEqualTo(AttemptStatus.COMPLETED);
    }

    @Test
    @DisplayName("applyUpdate refuses to write once the end time has passed")
    void applyUpdateGuardsEndTime() {
        TestAttempt open = attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));

        int late = attemptRepository.applyUpdate(open.getId(), AttemptStatus.STARTED, AttemptStatus.IN_PROGRESS,
                5, 120, null, T0.plus(Duration.ofMinutes(30)).plusMillis(1));
        assertThat(late).isZero();
        assertThat(reload(open.getId()).getQuestionsAnswered()).isZero();

        int onTime = attemptRepository.applyUpdate(open.getId(), AttemptStatus.STARTED, AttemptStatus.IN_PROGRESS,
                5, 120, null, T0.plus(Duration.ofMinutes(30)));
        TestAttempt reloaded = reload(open.getId());
        assertThat(onTime).isEqualTo(1);
        assertThat(reloaded.getStatus()).isEqualTo(AttemptStatus.IN_PROGRESS);
        assertThat(reloaded.getQuestionsAnswered()).isEqualTo(5);
    }

    @Test
    @DisplayName("applyUpdate loses to a concurrent status change")
    void applyUpdateGuardsStatus() {
        TestAttempt open = attemptRepository.saveAndFlush(attempt(AttemptStatus.IN_PROGRESS, null));

        int updated = attemptRepository.applyUpdate(open.getId(), AttemptStatus.STARTED, AttemptStatus.IN_PROGRESS,
                5, 120, null, T0.plus(Duration.ofMinutes(5)));

        assertThat(updated).isZero();
    }

    @Test
    @DisplayName("bulk expiry for a user touches only that user's overdue open attempts")
    void bulkExpiryForUser() {
        TestAttempt overdue = attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));
        TestAttempt someoneElse = attempt(AttemptStatus.STARTED, null);
        someoneElse.setUserId(UUID.randomUUID());
        someoneElse = attemptRepository.saveAndFlush(someoneElse);

        int updated = attemptRepository.expireOverdueForUser(userId, T0.plus(Duration.ofMinutes(31)),
                AttemptStatus.openStatuses(), AttemptStatus.EXPIRED);

        assertThat(updated).isEqualTo(1);
        assertThat(reload(overdue.getId()).getStatus()).isEqualTo(AttemptStatus.EXPIRED);
        assertThat(reload(someoneElse.getId()).getStatus()).isEqualTo(AttemptStatus.STARTED);
    }

    @Test
    @DisplayName("a second open attempt for the same user and test without a session is rejected")
    void oneOpenAttemptWithoutSession() {
        attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));

        assertThatThrownBy(() -> attemptRepository.saveAndFlush(attempt(AttemptStatus.IN_PROGRESS, null)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("finished attempts do not count against the open-attempt index")
    void terminalAttemptsAllowed() {
        attemptRepository.saveAndFlush(attempt(AttemptStatus.COMPLETED, null));
        attemptRepository.saveAndFlush(attempt(AttemptStatus.EXPIRED, null));

        TestAttempt open = attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));

        assertThat(open.getId()).isNotNull();
    }

    @Test
    @DisplayName("the open-attempt index is scoped per session")
    void openAttemptPerSession() {
        TestSession session = entityManager.persistAndFlush(TestSession.builder()
                .sessionCode("HIRE-" + UUID.randomUUID().toString().substring(0, 8))
                .sessionName("Graduate intake")
                .startTime(T0.minus(Duration.ofHours(1)))
                .endTime(T0.plus(Duration.ofHours(8)))
                .build());
        attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, null));

        TestAttempt inSession = attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, session.getId()));

        assertThat(inSession.getId()).isNotNull();
        assertThatThrownBy(() -> attemptRepository.saveAndFlush(attempt(AttemptStatus.STARTED, session.getId())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
