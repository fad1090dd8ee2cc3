package com.syntegra.assessment.modules.scoring.payload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MatrixAnswer(Map<String, Object> selection) implements AnswerPayload {

    public MatrixAnswer {
        selection = Collections.unmodifiableMap(new LinkedHashMap<>(selection));
    }
}
