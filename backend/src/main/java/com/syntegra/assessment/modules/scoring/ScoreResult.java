package com.syntegra.assessment.modules.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outcome of scoring one response. {@code isCorrect} is {@code null} for
 * items that have no right answer.
 */
public record ScoreResult(BigDecimal score, Boolean isCorrect) {

    public ScoreResult {
        score = score.setScale(2, RoundingMode.HALF_UP);
    }

    public static ScoreResult correct(BigDecimal points) {
        return new ScoreResult(points, Boolean.TRUE);
    }

    public static ScoreResult incorrect() {
        return new ScoreResult(BigDecimal.ZERO, Boolean.FALSE);
    }

    public static ScoreResult unjudged(BigDecimal score) {
        return new ScoreResult(score, null);
    }
}
