package com.syntegra.assessment.modules.session;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Weighted per-user aggregate over a session, maintained by reporting.
 */
@Entity
@Immutable
@Table(name = "session_results")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResult {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "weighted_score", precision = 6, scale = 2)
    private BigDecimal weightedScore;

    @Column(name = "overall_grade", length = 5)
    private String overallGrade;

    @Column(name = "overall_percentile")
    private Integer overallPercentile;

    @Column(name = "completion_percentage", precision = 5, scale = 2)
    private BigDecimal completionPercentage;

    @Column(name = "calculated_at")
    private Instant calculatedAt;
}
