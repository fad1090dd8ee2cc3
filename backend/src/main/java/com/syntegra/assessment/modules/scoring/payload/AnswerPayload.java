package com.syntegra.assessment.modules.scoring.payload;

/**
 * Parsed participant response. Each question type has exactly one variant;
 * {@link NoAnswer} stands for a row with no usable content.
 */
public interface AnswerPayload {

    default boolean isEmpty() {
        return false;
    }
}
