package com.syntegra.assessment.modules.scoring.payload;

/** Selected option value for multiple-choice and true/false questions. */
public record ChoiceAnswer(String value) implements AnswerPayload {
}
