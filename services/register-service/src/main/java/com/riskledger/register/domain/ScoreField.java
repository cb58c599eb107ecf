package com.riskledger.register.domain;

/**
 * Ordinal score carried by tracked records, with the request key of the reason
 * that must accompany a change to it.
 */
public enum ScoreField {
    LIKELIHOOD("likelihood", "likelihoodChangeReason"),
    CONSEQUENCE("consequence", "consequenceChangeReason"),
    IMPACT("impact", "impactChangeReason");

    public static final String STATUS_CHANGE_RATIONALE = "statusChangeRationale";

    private final String fieldName;
    private final String reasonKey;

    ScoreField(String fieldName, String reasonKey) {
        this.fieldName = fieldName;
        this.reasonKey = reasonKey;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getReasonKey() {
        return reasonKey;
    }
}
