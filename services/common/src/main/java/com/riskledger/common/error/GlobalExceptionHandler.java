package com.riskledger.common.error;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps register exceptions to {@link ErrorResponse} bodies and counts errors by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_DOCUMENTATION_BASE_URL = "https://riskledger.example.com/errors/";

    @Value("${spring.application.name:register-service}")
    private String serviceName;

    @Autowired(required = false)
    private MeterRegistry meterRegistry;

    private final Map<String, Counter> errorCounters = new ConcurrentHashMap<>();

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            ValidationException ex, HttpServletRequest request) {

        log.warn("Validation exception: {}", ex.getMessage());

        ErrorResponse body = buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
        body.setValidationErrors(ex.getFieldErrors().isEmpty() ? null : ex.getFieldErrors());
        body.setMetadata(ex.getMetadata().isEmpty() ? null : ex.getMetadata());

        recordError(ex.getErrorCode(), ex);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(
            BusinessException ex, HttpServletRequest request) {

        log.warn("Business exception: {} - {}", ex.getErrorCode(), ex.getMessage());

        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode());
        ErrorResponse body = buildErrorResponse(status, ex.getErrorCode(), ex.getMessage(), request);
        body.setMetadata(ex.getMetadata().isEmpty() ? null : ex.getMetadata());

        recordError(ex.getErrorCode(), ex);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.computeIfAbsent(error.getField(), key -> new ArrayList<>()).add(error.getDefaultMessage());
        }
        log.warn("Request validation failed: {}", fieldErrors.keySet());

        ErrorResponse body = buildErrorResponse(HttpStatus.BAD_REQUEST,
            ErrorCode.VALIDATION_FAILED.getCode(), "Validation failed", request);
        body.setValidationErrors(fieldErrors);

        recordError(ErrorCode.VALIDATION_FAILED.getCode(), ex);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse body = buildErrorResponse(HttpStatus.BAD_REQUEST,
            ErrorCode.VALIDATION_MALFORMED_REQUEST.getCode(), ex.getMessage(), request);

        recordError(ErrorCode.VALIDATION_MALFORMED_REQUEST.getCode(), ex);
        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Concurrent writers on the same record, or a duplicate version number.
     */
    @ExceptionHandler({OptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConflict(Exception ex, HttpServletRequest request) {
        log.warn("Conflicting write on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse body = buildErrorResponse(HttpStatus.CONFLICT,
            ErrorCode.SYS_CONCURRENT_MODIFICATION.getCode(),
            ErrorCode.SYS_CONCURRENT_MODIFICATION.getDefaultMessage(), request);

        recordError(ErrorCode.SYS_CONCURRENT_MODIFICATION.getCode(), ex);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse body = buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            ErrorCode.SYS_INTERNAL_ERROR.getCode(),
            "An unexpected error occurred. Please try again later.", request);

        recordError(ErrorCode.SYS_INTERNAL_ERROR.getCode(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ErrorResponse buildErrorResponse(HttpStatus status, String code, String detail,
                                             HttpServletRequest request) {
        return ErrorResponse.builder()
            .type(ERROR_DOCUMENTATION_BASE_URL + code.toLowerCase())
            .title(ErrorCode.fromCode(code).getDefaultMessage())
            .status(status.value())
            .detail(detail)
            .instance(request.getRequestURI())
            .code(code)
            .timestamp(Instant.now())
            .build();
    }

    private void recordError(String errorCode, Throwable exception) {
        if (meterRegistry == null) {
            return;
        }
        String errorType = exception.getClass().getSimpleName();
        Counter counter = errorCounters.computeIfAbsent(errorCode + ":" + errorType, key ->
            Counter.builder("riskledger.errors")
                .tag("service", serviceName)
                .tag("error_code", errorCode)
                .tag("error_type", errorType)
                .description("Count of errors by error code")
                .register(meterRegistry));
        counter.increment();
    }
}
