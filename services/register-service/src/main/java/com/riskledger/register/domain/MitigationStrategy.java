package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MitigationStrategy {
    ACCEPTANCE("acceptance"),
    AVOIDANCE("avoidance"),
    TRANSFER("transfer"),
    CONTROL("control"),
    BURN_DOWN("burn_down");

    private final String code;

    MitigationStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MitigationStrategy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (MitigationStrategy strategy : values()) {
            if (strategy.code.equalsIgnoreCase(code.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown mitigation strategy: " + code);
    }
}
