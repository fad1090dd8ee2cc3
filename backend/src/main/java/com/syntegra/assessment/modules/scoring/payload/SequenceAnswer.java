package com.syntegra.assessment.modules.scoring.payload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record SequenceAnswer(List<Object> items) implements AnswerPayload {

    public SequenceAnswer {
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }
}
