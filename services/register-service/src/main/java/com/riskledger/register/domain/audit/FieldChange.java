package com.riskledger.register.domain.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Old and new value of one audited field. Nulls are kept so a cleared field reads {@code "to": null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record FieldChange(Object from, Object to) {
}
