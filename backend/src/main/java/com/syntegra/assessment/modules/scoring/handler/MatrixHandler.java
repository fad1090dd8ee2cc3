package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.MatrixAnswer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class MatrixHandler extends OpenResponseHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MATRIX;
    }

    @Override
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        Object selection = answerData == null ? null : answerData.get("matrix_selection");
        if (!(selection instanceof Map<?, ?> cells)) {
            throw invalid(ANSWER_DATA_FIELD, "Matrix selection is required for matrix questions");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        cells.forEach((row, value) -> normalized.put(String.valueOf(row), value));
        return new MatrixAnswer(normalized);
    }

    @Override
    protected Object comparableValue(AnswerPayload payload) {
        return ((MatrixAnswer) payload).selection();
    }
}
