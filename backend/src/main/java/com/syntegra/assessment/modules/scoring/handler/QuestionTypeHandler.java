package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;

import java.util.Map;

/**
 * Parsing and objective scoring for one question type.
 */
public abstract class QuestionTypeHandler {

    protected static final String ANSWER_FIELD = "answer";
    protected static final String ANSWER_DATA_FIELD = "answerData";

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * Parses a submitted response into this type's payload variant.
     *
     * @throws BusinessException with {@link ErrorKind#INVALID_ANSWER_FORMAT} when the shape is wrong
     */
    public abstract AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context);

    /**
     * Scores a non-empty payload produced by {@link #parse}. Personality and
     * rating items never reach this method.
     */
    public abstract ScoreResult score(AnswerPayload payload, ScoringContext context);

    protected BusinessException invalid(String field, String message) {
        return new BusinessException(ErrorKind.INVALID_ANSWER_FORMAT, field, message);
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
