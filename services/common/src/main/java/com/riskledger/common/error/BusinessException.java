package com.riskledger.common.error;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Base exception for register domain errors.
 *
 * Carries an error code, the HTTP status it maps to and optional metadata
 * that the exception handler copies into the error response.
 */
@Getter
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 2L;

    private final String errorCode;
    private final int statusCode;
    private final Map<String, Object> metadata;

    public BusinessException(ErrorCode errorCode, String message) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getHttpStatus().value();
        this.metadata = new HashMap<>();
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getHttpStatus().value();
        this.metadata = new HashMap<>();
    }

    /**
     * Constructor with error code, message, and status code
     */
    public BusinessException(String errorCode, String message, int statusCode) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.metadata = new HashMap<>();
    }

    /**
     * Add metadata entry (fluent API)
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }
}
