package com.syntegra.assessment.exception;

public class UnauthorizedAccessException extends AssessmentException {

    public UnauthorizedAccessException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
