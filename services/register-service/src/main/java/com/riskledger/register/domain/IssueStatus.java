package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue handling decision. No issue status is gated behind a rationale.
 */
public enum IssueStatus implements TrackedStatus {
    IGNORE("ignore"),
    CONTROL("control");

    private final String code;

    IssueStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public boolean isRationaleRequired() {
        return false;
    }

    @JsonCreator
    public static IssueStatus fromCode(String code) {
        return StatusCodes.resolve(values(), code, "status");
    }
}
