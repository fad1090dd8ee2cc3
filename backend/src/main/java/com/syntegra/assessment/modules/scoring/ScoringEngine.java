package com.syntegra.assessment.modules.scoring;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.handler.QuestionTypeHandlerRegistry;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.ChoiceAnswer;
import com.syntegra.assessment.modules.scoring.payload.NoAnswer;
import com.syntegra.assessment.modules.scoring.payload.RatingAnswer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Stateless entry point for parsing and scoring responses.
 * <p>
 * Rating items and every item of a personality-class test are unjudged:
 * {@code isCorrect} stays {@code null} and the score is the chosen option's
 * points, falling back to the numeric rating. All other types delegate to
 * their {@link com.syntegra.assessment.modules.scoring.handler.QuestionTypeHandler}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    private final QuestionTypeHandlerRegistry handlerRegistry;

    /**
     * Strict parse used on final submissions.
     *
     * @throws BusinessException with INVALID_ANSWER_FORMAT when the payload does not fit the type
     */
    public AnswerPayload parse(ScoringContext context, String answer, Map<String, Object> answerData) {
        return handlerRegistry.getHandler(context.type()).parse(answer, answerData, context);
    }

    /**
     * Parse used when re-reading stored rows, which may hold drafts that never
     * passed validation. Unparseable content counts as no answer.
     */
    public AnswerPayload parseStored(ScoringContext context, String answer, Map<String, Object> answerData) {
        if (!hasContent(answer, answerData)) {
            return NoAnswer.INSTANCE;
        }
        try {
            return parse(context, answer, answerData);
        } catch (BusinessException e) {
            log.debug("Stored {} answer treated as empty: {}", context.type(), e.getMessage());
            return NoAnswer.INSTANCE;
        }
    }

    public ScoreResult score(AnswerPayload payload, ScoringContext context) {
        if (context.personalityClass() || context.type() == QuestionType.RATING_SCALE) {
            return scoreUnjudged(payload, context);
        }
        if (payload.isEmpty()) {
            return ScoreResult.incorrect();
        }
        return handlerRegistry.getHandler(context.type()).score(payload, context);
    }

    public static boolean hasContent(String answer, Map<String, Object> answerData) {
        return (answer != null && !answer.isBlank()) || (answerData != null && !answerData.isEmpty());
    }

    /** Numeric rating carried by a payload, or {@code null} when it has none. */
    public static Integer ratingOf(AnswerPayload payload) {
        if (payload instanceof RatingAnswer rating) {
            return rating.rating();
        }
        if (payload instanceof ChoiceAnswer choice) {
            try {
                return Integer.valueOf(choice.value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private ScoreResult scoreUnjudged(AnswerPayload payload, ScoringContext context) {
        if (payload instanceof ChoiceAnswer choice) {
            BigDecimal optionScore = context.optionScore(choice.value()).orElse(null);
            if (optionScore != null) {
                return ScoreResult.unjudged(optionScore);
            }
        }
        Integer rating = ratingOf(payload);
        return ScoreResult.unjudged(rating == null ? BigDecimal.ZERO : BigDecimal.valueOf(rating));
    }
}
