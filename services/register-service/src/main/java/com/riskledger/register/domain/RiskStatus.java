package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskStatus implements TrackedStatus {
    OPEN("open", false),
    MITIGATING("mitigating", false),
    ACCEPTED("accepted", true),
    CLOSED("closed", true),
    REALIZED("realized", true);

    private final String code;
    private final boolean rationaleRequired;

    RiskStatus(String code, boolean rationaleRequired) {
        this.code = code;
        this.rationaleRequired = rationaleRequired;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public boolean isRationaleRequired() {
        return rationaleRequired;
    }

    @JsonCreator
    public static RiskStatus fromCode(String code) {
        return StatusCodes.resolve(values(), code, "status");
    }
}
