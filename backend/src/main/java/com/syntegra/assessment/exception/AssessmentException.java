package com.syntegra.assessment.exception;

import lombok.Getter;

@Getter
public class AssessmentException extends RuntimeException {

    private final ErrorKind kind;

    /** Request field the failure refers to, or {@code null}. */
    private final String field;

    public AssessmentException(ErrorKind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public AssessmentException(ErrorKind kind, String message) {
        this(kind, null, message);
    }
}
