package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.modules.scoring.payload.SequenceAnswer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SequenceHandler extends OpenResponseHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SEQUENCE;
    }

    @Override
    @SuppressWarnings("unchecked")
    public AnswerPayload parse(String answer, Map<String, Object> answerData, ScoringContext context) {
        Object sequence = answerData == null ? null : answerData.get("sequence");
        if (!(sequence instanceof List<?> items)) {
            throw invalid(ANSWER_DATA_FIELD, "Sequence must be an array");
        }
        return new SequenceAnswer((List<Object>) items);
    }

    @Override
    protected Object comparableValue(AnswerPayload payload) {
        return ((SequenceAnswer) payload).items();
    }
}
