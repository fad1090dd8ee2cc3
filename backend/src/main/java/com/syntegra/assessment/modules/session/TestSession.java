package com.syntegra.assessment.modules.session;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A scheduled sitting that bundles several tests under one access code.
 */
@Entity
@Table(name = "test_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_code", nullable = false, unique = true, length = 50)
    private String sessionCode;

    @Column(name = "session_name", nullable = false, length = 255)
    private String sessionName;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.DRAFT;

    @Column(name = "auto_expire", nullable = false)
    @Builder.Default
    private Boolean autoExpire = true;

    @Column(name = "target_position", length = 255)
    private String targetPosition;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public boolean isOpenAt(Instant now) {
        return status == SessionStatus.ACTIVE && !now.isBefore(startTime) && !now.isAfter(endTime);
    }
}
