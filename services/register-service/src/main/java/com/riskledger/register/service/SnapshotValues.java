package com.riskledger.register.service;

import java.time.temporal.Temporal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Converts snapshot values into their JSON form: temporals as ISO-8601 strings, UUIDs as strings.
 */
public final class SnapshotValues {

    private SnapshotValues() {
    }

    public static Object toJsonValue(Object value) {
        if (value instanceof Temporal || value instanceof UUID) {
            return value.toString();
        }
        return value;
    }

    public static Map<String, Object> toJson(Map<String, Object> snapshot) {
        Map<String, Object> json = new LinkedHashMap<>();
        snapshot.forEach((key, value) -> json.put(key, toJsonValue(value)));
        return json;
    }
}
