package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.TextAnswer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class TextHandler extends OpenResponseHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TEXT;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        String text = answer;
        if (!hasText(text) && answerData != null && answerData.get("text") instanceof String value) {
            text = value;
        }
        if (!hasText(text)) {
            throw invalid(ANSWER_FIELD, "Answer text is required");
        }
        return new TextAnswer(text);
    }

    @Override
    protected Object comparableValue(AnswerPayload payload) {
        return ((TextAnswer) payload).text().trim();
    }
}
