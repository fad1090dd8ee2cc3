package com.syntegra.assessment.exception;

public class BusinessException extends AssessmentException {

    public BusinessException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public BusinessException(ErrorKind kind, String field, String message) {
        super(kind, field, message);
    }
}
