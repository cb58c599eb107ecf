package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.riskledger.common.error.ValidationException;

/**
 * Category list a record kind resolves its category code against.
 */
public enum CategoryScheme {
    RISK("risk"),
    OPPORTUNITY("opportunity");

    private final String code;

    CategoryScheme(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CategoryScheme fromCode(String code) {
        for (CategoryScheme scheme : values()) {
            if (scheme.code.equalsIgnoreCase(code)) {
                return scheme;
            }
        }
        throw ValidationException.invalidValue("scheme", code);
    }
}
