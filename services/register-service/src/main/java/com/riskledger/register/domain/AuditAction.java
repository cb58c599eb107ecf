package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
