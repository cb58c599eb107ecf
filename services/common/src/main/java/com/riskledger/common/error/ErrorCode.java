package com.riskledger.common.error;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned by the register services.
 *
 * Format: MODULE_NNNN
 * - 5xxx: System & Infrastructure
 * - 7xxx: Validation & Data
 * - 9xxx: Register domain
 */
public enum ErrorCode {

    // ===== 5xxx: SYSTEM =====
    SYS_INTERNAL_ERROR("SYS_5001", "Internal system error", HttpStatus.INTERNAL_SERVER_ERROR),
    SYS_CONCURRENT_MODIFICATION("SYS_5009", "Record was modified concurrently", HttpStatus.CONFLICT),

    // ===== 7xxx: VALIDATION =====
    VALIDATION_FAILED("VAL_7001", "Validation failed", HttpStatus.BAD_REQUEST),
    VALIDATION_REQUIRED_FIELD("VAL_7002", "Required field is missing", HttpStatus.BAD_REQUEST),
    VALIDATION_RATIONALE_REQUIRED("VAL_7003", "Change rationale is required", HttpStatus.BAD_REQUEST),
    VALIDATION_INVALID_VALUE("VAL_7004", "Invalid field value", HttpStatus.BAD_REQUEST),
    VALIDATION_MALFORMED_REQUEST("VAL_7005", "Malformed request", HttpStatus.BAD_REQUEST),

    // ===== 9xxx: REGISTER DOMAIN =====
    RESOURCE_NOT_FOUND("REG_9001", "Resource not found", HttpStatus.NOT_FOUND),
    RECORD_NOT_FOUND("REG_9002", "Register record not found", HttpStatus.NOT_FOUND),
    STEP_NOT_FOUND("REG_9003", "Step not found", HttpStatus.NOT_FOUND),
    VERSION_NOT_FOUND("REG_9004", "No version at that date", HttpStatus.NOT_FOUND),
    INVALID_STATE_TRANSITION("REG_9005", "Operation not allowed in the current state", HttpStatus.UNPROCESSABLE_ENTITY);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String defaultMessage, HttpStatus httpStatus) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        if (code == null) {
            return SYS_INTERNAL_ERROR;
        }
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
