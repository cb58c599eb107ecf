package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a version or audit entry describes the top-level record or one of its steps.
 */
public enum RecordScope {
    ENTITY("entity"),
    STEP("step");

    private final String code;

    RecordScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
