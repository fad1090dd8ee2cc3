package com.syntegra.assessment.modules.attempt;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One participant's timed run through one test. Status changes go through the
 * guarded updates in {@link TestAttemptRepository}; the row is never deleted.
 */
@Entity
@Table(name = "test_attempts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "test_id", nullable = false, updatable = false)
    private UUID testId;

    @Column(name = "session_id", updatable = false)
    private UUID sessionId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    /** start_time plus the test's time limit; fixed at creation. */
    @Column(name = "end_time", nullable = false, updatable = false)
    private Instant endTime;

    @Column(name = "actual_end_time")
    private Instant actualEndTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AttemptStatus status = AttemptStatus.STARTED;

    @Column(name = "questions_answered", nullable = false)
    @Builder.Default
    private Integer questionsAnswered = 0;

    @Column(name = "total_questions", nullable = false)
    @Builder.Default
    private Integer totalQuestions = 0;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    @Builder.Default
    private Integer attemptNumber = 1;

    /** Seconds reported by the client. */
    @Column(name = "time_spent")
    private Integer timeSpent;

    @Column(name = "ip_address", length = 50)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "browser_info", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> browserInfo;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isOverdue(Instant now) {
        return now.isAfter(endTime);
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }
}
