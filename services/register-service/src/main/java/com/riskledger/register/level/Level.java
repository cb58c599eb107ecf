package com.riskledger.register.level;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity band derived from a pair of ordinal scores.
 */
public enum Level {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    private final String code;

    Level(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Level fromCode(String code) {
        for (Level level : values()) {
            if (level.code.equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown level: " + code);
    }
}
