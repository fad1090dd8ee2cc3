package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.ChoiceAnswer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

@Component
public class MultipleChoiceHandler extends QuestionTypeHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        String value = hasText(answer) ? answer.trim() : null;
        if (value == null && answerData != null && answerData.get("value") instanceof String selected
                && hasText(selected)) {
            value = selected.trim();
        }
        if (value == null) {
            throw invalid(ANSWER_FIELD, "Answer is required for multiple choice questions");
        }
        if (!context.options().isEmpty() && context.findOption(value).isEmpty()) {
            throw invalid(ANSWER_FIELD, "Answer must be one of the available options");
        }
        return new ChoiceAnswer(value);
    }

    @Override
    public ScoreResult score(AnswerPayload payload, ScoringContext context) {
        String value = ((ChoiceAnswer) payload).value();
        boolean correct = value.equals(context.correctAnswer());
        return context.optionScore(value)
                .map(points -> new ScoreResult(points, correct))
                .orElseGet(() -> correct ? ScoreResult.correct(BigDecimal.ONE) : ScoreResult.incorrect());
    }
}
