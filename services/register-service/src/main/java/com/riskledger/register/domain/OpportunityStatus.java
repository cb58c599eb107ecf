package com.riskledger.register.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OpportunityStatus implements TrackedStatus {
    PURSUE_NOW("pursue_now", false),
    DEFER("defer", true),
    REEVALUATE("reevaluate", true),
    REJECT("reject", true);

    private final String code;
    private final boolean rationaleRequired;

    OpportunityStatus(String code, boolean rationaleRequired) {
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
    public static OpportunityStatus fromCode(String code) {
        return StatusCodes.resolve(values(), code, "status");
    }
}
