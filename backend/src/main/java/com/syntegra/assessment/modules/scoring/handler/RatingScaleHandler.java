package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.RatingAnswer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

@Component
public class RatingScaleHandler extends QuestionTypeHandler {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 10;

    @Override
    public QuestionType supportedType() {
        return QuestionType.RATING_SCALE;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        Object raw = answer;
        String field = ANSWER_FIELD;
        if (!hasText(answer) && answerData != null) {
            raw = answerData.get("value") != null ? answerData.get("value") : answerData.get("rating");
            field = ANSWER_DATA_FIELD;
        }
        if (raw == null || (raw instanceof String s && s.isBlank())) {
            throw invalid(ANSWER_FIELD, "Rating is required for rating scale questions");
        }
        Integer rating = toInteger(raw);
        if (rating == null || rating < MIN_RATING || rating > MAX_RATING) {
            throw invalid(field, "Rating must be an integer between " + MIN_RATING + " and " + MAX_RATING);
        }
        return new RatingAnswer(rating);
    }

    // Ratings carry no right answer; the engine routes them to its unjudged rule.
    @Override
    public ScoreResult score(AnswerPayload payload, ScoringContext context) {
        return ScoreResult.unjudged(BigDecimal.valueOf(((RatingAnswer) payload).rating()));
    }

    static Integer toInteger(Object raw) {
        if (raw instanceof Number n) {
            double value = n.doubleValue();
            return value == Math.rint(value) ? (int) value : null;
        }
        try {
            return Integer.valueOf(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
