package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.DrawingAnswer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DrawingHandler extends OpenResponseHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.DRAWING;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        Object data = answerData == null ? null : answerData.get("drawing_data");
        if (!(data instanceof String drawing) || drawing.isBlank()) {
            throw invalid(ANSWER_DATA_FIELD, "Drawing data is required for drawing questions");
        }
        return new DrawingAnswer(drawing);
    }

    @Override
    protected Object comparableValue(AnswerPayload payload) {
        return ((DrawingAnswer) payload).drawingData();
    }
}
