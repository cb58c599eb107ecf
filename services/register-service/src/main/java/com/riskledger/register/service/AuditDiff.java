package com.riskledger.register.service;

import com.riskledger.register.domain.audit.FieldChange;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level comparison of two snapshots.
 */
public final class AuditDiff {

    private AuditDiff() {
    }

    /**
     * Returns the fields whose values differ, in snapshot order, with JSON-ready from/to values.
     * Timestamps are compared by instant.
     */
    public static Map<String, FieldChange> diff(Map<String, Object> before, Map<String, Object> after,
                                                Set<String> ignoredFields) {
        Set<String> fields = new LinkedHashSet<>(before.keySet());
        fields.addAll(after.keySet());
        fields.removeAll(ignoredFields);

        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String field : fields) {
            Object from = before.get(field);
            Object to = after.get(field);
            if (!sameValue(from, to)) {
                changes.put(field, new FieldChange(SnapshotValues.toJsonValue(from), SnapshotValues.toJsonValue(to)));
            }
        }
        return changes;
    }

    static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        Instant instantA = asInstant(a);
        Instant instantB = asInstant(b);
        if (instantA != null && instantB != null) {
            return instantA.equals(instantB);
        }
        if (a instanceof Number numberA && b instanceof Number numberB) {
            return numberA.longValue() == numberB.longValue();
        }
        return Objects.equals(a, b);
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return null;
    }
}
