package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.key.ExpectedValueScoringKey;
import com.syntegra.assessment.modules.scoring.key.PointsScoringKey;
import com.syntegra.assessment.modules.scoring.key.ScoringKey;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scoring shared by text, drawing, sequence and matrix items.
 * <p>
 * Without a value key any response is credited with one point and marked
 * correct. An expected-value key switches to exact matching; a points key
 * looks the response up and marks it correct when it earns points.
 */
public abstract class OpenResponseHandler extends QuestionTypeHandler {

    /** Value compared against the scoring key. */
    protected abstract Object comparableValue(AnswerPayload payload);

    @Override
    public ScoreResult score(AnswerPayload payload, ScoringContext context) {
        ScoringKey key = context.scoringKey();
        Object value = comparableValue(payload);

        if (key instanceof ExpectedValueScoringKey expected) {
            return matches(value, expected.expected())
                    ? ScoreResult.correct(expected.points())
                    : ScoreResult.incorrect();
        }
        if (key instanceof PointsScoringKey points) {
            BigDecimal earned = points.points().getOrDefault(String.valueOf(value), BigDecimal.ZERO);
            return new ScoreResult(earned, earned.signum() > 0);
        }
        return ScoreResult.correct(BigDecimal.ONE);
    }

    protected boolean matches(Object value, Object expected) {
        if (value instanceof String text && expected != null) {
            return text.trim().equals(String.valueOf(expected).trim());
        }
        return Objects.equals(value, expected);
    }
}
