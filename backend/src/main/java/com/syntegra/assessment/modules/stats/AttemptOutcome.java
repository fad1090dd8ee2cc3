package com.syntegra.assessment.modules.stats;

import com.syntegra.assessment.modules.attempt.AttemptStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** One attempt joined with its result, if any. */
public record AttemptOutcome(
        UUID userId,
        AttemptStatus status,
        Integer timeSpent,
        Instant startTime,
        BigDecimal rawScore,
        BigDecimal scaledScore) {
}
