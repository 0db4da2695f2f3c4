package com.flagship.telehealth_booking.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every failure onto the uniform error envelope.
 *
 * Validation, authorization, state and conflict failures are expected outcomes
 * and are logged at INFO; only dependency and internal failures are logged as errors.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String CONSULTATION_ID_MDC_KEY = "consultationId";

    @ExceptionHandler(TelehealthException.class)
    public ResponseEntity<ApiError> handleTelehealthException(TelehealthException e) {
        ErrorCode code = e.getErrorCode();
        if (code.isClientError()) {
            log.info("Request rejected: code={}, consultationId={}, message={}",
                    code, MDC.get(CONSULTATION_ID_MDC_KEY), e.getMessage());
            return respond(code, e.getMessage(), e.getDetails());
        }

        log.error("Request failed: code={}, consultationId={}", code, MDC.get(CONSULTATION_ID_MDC_KEY), e);
        return respond(code, "An unexpected error occurred", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
                fields.putIfAbsent(error.getField(),
                        error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));

        log.info("Validation failed: fields={}", fields.keySet());
        return respond(ErrorCode.VALIDATION_ERROR, "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.info("Malformed request body: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Malformed request body", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.info("Invalid value for parameter '{}': {}", e.getName(), e.getValue());
        return respond(ErrorCode.VALIDATION_ERROR,
                "Invalid value for parameter '" + e.getName() + "'",
                Map.of("parameter", e.getName()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.info("Missing request parameter: {}", e.getParameterName());
        return respond(ErrorCode.VALIDATION_ERROR,
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.info("Missing required header: {}", e.getHeaderName());
        return respond(ErrorCode.VALIDATION_ERROR,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR, e.getMessage(), null));
    }

    /**
     * Unique and exclusion constraints are the last line of defence for concurrent writers.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.info("Constraint violation: consultationId={}, cause={}",
                MDC.get(CONSULTATION_ID_MDC_KEY), e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.CONFLICT, "The request conflicts with the current state of the resource", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error: consultationId={}", MDC.get(CONSULTATION_ID_MDC_KEY), e);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(ErrorCode code, String message, Map<String, Object> details) {
        return ResponseEntity.status(code.getHttpStatus()).body(ApiError.of(code, message, details));
    }
}
