package com.syntegra.assessment.modules.scoring.payload;

/** Serialized drawing (typically a data URL or stroke JSON). */
public record DrawingAnswer(String drawingData) implements AnswerPayload {
}
