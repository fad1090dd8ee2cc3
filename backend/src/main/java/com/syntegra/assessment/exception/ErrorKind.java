package com.syntegra.assessment.exception;

/**
 * Failure categories surfaced to API clients. The HTTP status for each kind is
 * decided in {@link GlobalExceptionHandler}.
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    ATTEMPT_NOT_ACTIVE,
    INVALID_STATUS_TRANSITION,
    INVALID_ANSWER_FORMAT,
    INVALID_PROGRESS,
    TEST_NOT_AVAILABLE,
    SESSION_NOT_ACTIVE,
    ATTEMPT_NOT_COMPLETED,
    VALIDATION_FAILED,
    DATA_INTEGRITY_ERROR,
    INTERNAL_ERROR
}
