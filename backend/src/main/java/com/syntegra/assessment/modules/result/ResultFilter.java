package com.syntegra.assessment.modules.result;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Optional criteria for the result listings, bound from query parameters.
 * The owning user or test comes from the path and overrides any value here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultFilter {
    private UUID userId;
    private UUID testId;
    private UUID sessionId;
    private Boolean isPassed;
    private Grade grade;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private Instant calculatedFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private Instant calculatedTo;

    /** Bounds on the scaled score. */
    @Min(0) @Max(100)
    private BigDecimal minScore;

    @Min(0) @Max(100)
    private BigDecimal maxScore;

    @Min(0) @Max(100)
    private Integer minPercentile;

    @Min(0) @Max(100)
    private Integer maxPercentile;

    private boolean includeRecommendations;
}
