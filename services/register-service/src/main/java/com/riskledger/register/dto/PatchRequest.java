package com.riskledger.register.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial update body. Setters of clearable fields mark the field as present, so an explicit
 * JSON {@code null} clears the value while an absent field keeps it.
 */
public abstract class PatchRequest {

    @JsonIgnore
    private final Set<String> presentFields = new HashSet<>();

    protected void markPresent(String field) {
        presentFields.add(field);
    }

    @JsonIgnore
    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }

    protected static Map<String, String> reasons(String... keysAndValues) {
        Map<String, String> reasons = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                reasons.put(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return reasons;
    }
}
