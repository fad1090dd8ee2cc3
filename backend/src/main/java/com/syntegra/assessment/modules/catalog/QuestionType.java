package com.syntegra.assessment.modules.catalog;

public enum QuestionType {
    MULTIPLE_CHOICE, TRUE_FALSE, TEXT, RATING_SCALE, DRAWING, SEQUENCE, MATRIX
}
