package com.syntegra.assessment.modules.scoring.payload;

public record NoAnswer() implements AnswerPayload {

    public static final NoAnswer INSTANCE = new NoAnswer();

    @Override
    public boolean isEmpty() {
        return true;
    }
}
