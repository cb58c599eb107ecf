package com.riskledger.common.error;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when validation fails, with field-level errors.
 */
@Getter
public class ValidationException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;
    private final Map<String, List<String>> fieldErrors;

    /**
     * Constructor with single error message
     */
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
        this.errors = List.of(message);
        this.fieldErrors = new LinkedHashMap<>();
    }

    /**
     * Constructor with field and single error
     */
    public ValidationException(String field, String message) {
        this(ErrorCode.VALIDATION_FAILED, field, message);
    }

    public ValidationException(ErrorCode errorCode, String field, String message) {
        super(errorCode, String.format("Validation failed for field '%s': %s", field, message));
        this.errors = List.of(message);
        this.fieldErrors = new LinkedHashMap<>();
        this.fieldErrors.put(field, List.of(message));
    }

    /**
     * Constructor with field errors map
     */
    public ValidationException(ErrorCode errorCode, String message, Map<String, List<String>> fieldErrors) {
        super(errorCode, message);
        this.fieldErrors = fieldErrors != null ? new LinkedHashMap<>(fieldErrors) : new LinkedHashMap<>();
        this.errors = new ArrayList<>();
        this.fieldErrors.values().forEach(errors::addAll);
    }

    public boolean hasFieldError(String field) {
        return fieldErrors.containsKey(field);
    }

    // Static factory methods

    public static ValidationException requiredField(String field) {
        return new ValidationException(ErrorCode.VALIDATION_REQUIRED_FIELD, field, "is required");
    }

    public static ValidationException invalidValue(String field, Object value) {
        return new ValidationException(ErrorCode.VALIDATION_INVALID_VALUE, field,
            String.format("invalid value '%s'", value));
    }
}
