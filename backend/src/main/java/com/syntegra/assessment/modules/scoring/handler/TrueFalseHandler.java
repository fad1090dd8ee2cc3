package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.ChoiceAnswer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

@Component
public class TrueFalseHandler extends QuestionTypeHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRUE_FALSE;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        String value = answer;
        if (!hasText(value) && answerData != null && answerData.get("value") != null) {
            value = String.valueOf(answerData.get("value"));
        }
        if (!hasText(value)) {
            throw invalid(ANSWER_FIELD, "Answer is required for true/false questions");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("true") && !normalized.equals("false")) {
            throw invalid(ANSWER_FIELD, "Answer must be 'true' or 'false'");
        }
        return new ChoiceAnswer(normalized);
    }

    @Override
    public ScoreResult score(AnswerPayload payload, ScoringContext context) {
        String value = ((ChoiceAnswer) payload).value();
        boolean correct = context.correctAnswer() != null
                && value.equalsIgnoreCase(context.correctAnswer().trim());
        return context.optionScore(value)
                .map(points -> new ScoreResult(points, correct))
                .orElseGet(() -> correct ? ScoreResult.correct(BigDecimal.ONE) : ScoreResult.incorrect());
    }
}
