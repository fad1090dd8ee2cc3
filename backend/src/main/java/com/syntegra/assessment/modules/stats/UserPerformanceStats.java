package com.syntegra.assessment.modules.stats;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Derived per-user snapshot, rebuilt wholesale by the statistics job. */
@Entity
@Table(name = "user_performance_stats")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPerformanceStats {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "total_tests_taken", nullable = false)
    private Integer totalTestsTaken;

    @Column(name = "total_tests_completed", nullable = false)
    private Integer totalTestsCompleted;

    @Column(name = "average_raw_score", precision = 8, scale = 2)
    private BigDecimal averageRawScore;

    @Column(name = "average_scaled_score", precision = 6, scale = 2)
    private BigDecimal averageScaledScore;

    @Column(name = "highest_scaled_score", precision = 6, scale = 2)
    private BigDecimal highestScaledScore;

    @Column(name = "lowest_scaled_score", precision = 6, scale = 2)
    private BigDecimal lowestScaledScore;

    /** Seconds. */
    @Column(name = "total_time_spent", nullable = false)
    private Long totalTimeSpent;

    @Column(name = "average_time_per_test")
    private Integer averageTimePerTest;

    @Column(name = "completion_rate", precision = 5, scale = 2)
    private BigDecimal completionRate;

    @Column(name = "consistency_score", precision = 5, scale = 2)
    private BigDecimal consistencyScore;

    @Column(name = "performance_rank")
    private Integer performanceRank;

    @Column(name = "performance_percentile", precision = 5, scale = 2)
    private BigDecimal performancePercentile;

    @Column(name = "last_test_date")
    private Instant lastTestDate;

    @Column(name = "last_calculated_at", nullable = false)
    private Instant lastCalculatedAt;
}
