package com.syntegra.assessment.modules.result;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "test_results")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "attempt_id", nullable = false, unique = true, updatable = false)
    private UUID attemptId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "test_id", nullable = false, updatable = false)
    private UUID testId;

    @Column(name = "session_result_id")
    private UUID sessionResultId;

    @Column(name = "raw_score", precision = 8, scale = 2)
    private BigDecimal rawScore;

    @Column(name = "scaled_score", precision = 6, scale = 2)
    private BigDecimal scaledScore;

    private Integer percentile;

    @Column(length = 5)
    private String grade;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<TraitScore> traits;

    @Column(name = "trait_names", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> traitNames;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String recommendations;

    @Column(name = "is_passed")
    private Boolean isPassed;

    @Column(name = "completion_percentage", precision = 5, scale = 2)
    private BigDecimal completionPercentage;

    @Column(name = "calculated_at", nullable = false)
    private Instant calculatedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @lombok.Data
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    @lombok.Builder
    public static class TraitScore {
        private String name;
        private String key;
        private Integer score; // 0..100
        private String description;
        private String category;
        private Double rawAverage;
        private Integer questionCount;
    }
}
