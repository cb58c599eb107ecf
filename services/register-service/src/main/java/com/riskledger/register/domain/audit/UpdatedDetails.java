package com.riskledger.register.domain.audit;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskledger.register.domain.AuditAction;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level diff of an update. Change reasons serialize as top-level properties
 * ({@code "likelihoodChangeReason": "..."}) next to {@code changes}.
 */
@Getter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class UpdatedDetails extends AuditDetails {

    private List<String> changedFields = new ArrayList<>();
    private Map<String, FieldChange> changes = new LinkedHashMap<>();

    @JsonIgnore
    private Map<String, String> reasons = new LinkedHashMap<>();

    public UpdatedDetails(Integer stepNumber, Map<String, FieldChange> changes, Map<String, String> reasons) {
        super(stepNumber);
        if (changes != null) {
            this.changes.putAll(changes);
            this.changedFields.addAll(changes.keySet());
        }
        if (reasons != null) {
            reasons.forEach(this::putReason);
        }
    }

    @Override
    public AuditAction getAction() {
        return AuditAction.UPDATED;
    }

    public void setChangedFields(List<String> changedFields) {
        this.changedFields = changedFields != null ? new ArrayList<>(changedFields) : new ArrayList<>();
    }

    public void setChanges(Map<String, FieldChange> changes) {
        this.changes = changes != null ? new LinkedHashMap<>(changes) : new LinkedHashMap<>();
    }

    @JsonAnyGetter
    public Map<String, String> reasonFields() {
        return Collections.unmodifiableMap(reasons);
    }

    @JsonAnySetter
    public void putReason(String key, String value) {
        if (value != null && !value.isBlank()) {
            reasons.put(key, value.trim());
        }
    }
}
