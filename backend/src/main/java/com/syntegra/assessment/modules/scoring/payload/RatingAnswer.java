package com.syntegra.assessment.modules.scoring.payload;

public record RatingAnswer(int rating) implements AnswerPayload {
}
