package com.syntegra.assessment.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AssessmentException.class)
    public ResponseEntity<ErrorResponse> handleAssessment(AssessmentException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getKind());
        List<FieldDetail> errors = ex.getField() == null
                ? List.of()
                : List.of(new FieldDetail(ex.getField(), ex.getMessage(), ex.getKind().name()));
        if (status.is5xxServerError()) {
            log.error("[{} {}] {} {} - {}", status.value(), ex.getKind(), request.getMethod(),
                    request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("[{} {}] {} {} - {}", status.value(), ex.getKind(), request.getMethod(),
                    request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), ex.getKind().name(), ex.getMessage(), errors,
                        request.getRequestURI()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("[403 ACCESS_DENIED] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse(HttpStatus.FORBIDDEN.value(), ErrorKind.FORBIDDEN.name(), "Access denied",
                        List.of(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        List<FieldDetail> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldDetail(error.getField(), error.getDefaultMessage(), error.getCode()))
                .toList();
        log.warn("[400 VALIDATION] {} {} - fields: {}", request.getMethod(), request.getRequestURI(),
                errors.stream().map(FieldDetail::field).toList());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), ErrorKind.VALIDATION_FAILED.name(),
                        "Validation failed", errors, request.getRequestURI()));
    }

    /** Constraint annotations on request parameters, such as paging bounds. */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleParameterValidation(HandlerMethodValidationException ex,
            HttpServletRequest request) {
        List<FieldDetail> errors = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> new FieldDetail(result.getMethodParameter().getParameterName(),
                                error.getDefaultMessage(), codeOf(error.getCodes()))))
                .toList();
        return parameterValidationFailed(errors, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
            HttpServletRequest request) {
        List<FieldDetail> errors = ex.getConstraintViolations().stream()
                .map(violation -> new FieldDetail(leafName(violation.getPropertyPath()), violation.getMessage(),
                        constraintName(violation)))
                .toList();
        return parameterValidationFailed(errors, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        log.warn("[400 MALFORMED] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        String field = ex instanceof MethodArgumentTypeMismatchException mismatch ? mismatch.getName() : null;
        List<FieldDetail> errors = field == null
                ? List.of()
                : List.of(new FieldDetail(field, "Invalid value", ErrorKind.VALIDATION_FAILED.name()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), ErrorKind.VALIDATION_FAILED.name(),
                        "Malformed request", errors, request.getRequestURI()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
            HttpServletRequest request) {
        log.error("[500 DATA_INTEGRITY_ERROR] {} {} - {}", request.getMethod(), request.getRequestURI(),
                ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(),
                        ErrorKind.DATA_INTEGRITY_ERROR.name(), "Data integrity error", List.of(),
                        request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("[500 INTERNAL_ERROR] {} {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorKind.INTERNAL_ERROR.name(),
                        "Internal server error", List.of(), request.getRequestURI()));
    }

    private ResponseEntity<ErrorResponse> parameterValidationFailed(List<FieldDetail> errors,
            HttpServletRequest request) {
        log.warn("[400 VALIDATION] {} {} - parameters: {}", request.getMethod(), request.getRequestURI(),
                errors.stream().map(FieldDetail::field).toList());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), ErrorKind.VALIDATION_FAILED.name(),
                        "Validation failed", errors, request.getRequestURI()));
    }

    private static String leafName(Path path) {
        String name = null;
        for (Path.Node node : path) {
            name = node.getName();
        }
        return name;
    }

    private static String constraintName(ConstraintViolation<?> violation) {
        return violation.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName();
    }

    // Resolvable codes run from most to least specific; the last one is the bare constraint name
    private static String codeOf(String[] codes) {
        return codes == null || codes.length == 0 ? null : codes[codes.length - 1];
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case ATTEMPT_NOT_COMPLETED -> HttpStatus.CONFLICT;
            case ATTEMPT_NOT_ACTIVE, INVALID_STATUS_TRANSITION, INVALID_ANSWER_FORMAT, INVALID_PROGRESS,
                    TEST_NOT_AVAILABLE, SESSION_NOT_ACTIVE, VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case DATA_INTEGRITY_ERROR, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public record FieldDetail(String field, String message, String code) {
    }

    public record ErrorResponse(int status, String code, String message, List<FieldDetail> errors, String path,
            Instant timestamp) {
        public ErrorResponse(int status, String code, String message, List<FieldDetail> errors, String path) {
            this(status, code, message, errors, path, Instant.now());
        }
    }
}
