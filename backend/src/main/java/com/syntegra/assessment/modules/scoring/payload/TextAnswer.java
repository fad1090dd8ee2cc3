package com.syntegra.assessment.modules.scoring.payload;

public record TextAnswer(String text) implements AnswerPayload {
}
