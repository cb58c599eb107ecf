package com.riskledger.register.service;

import com.riskledger.common.error.ErrorCode;
import com.riskledger.common.error.ValidationException;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.ScoreField;
import com.riskledger.register.domain.TrackedStatus;
import com.riskledger.register.level.ScorePair;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which change reasons a mutation must carry and rejects it before anything is written
 * when one is missing.
 *
 * <ul>
 *   <li>every changed score needs its {@code <score>ChangeReason}</li>
 *   <li>moving into a gated status of the kind needs a {@code statusChangeRationale}</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RationalePolicy {

    private final MeterRegistry meterRegistry;

    public Set<String> requiredReasons(EntityKind kind, Set<ScoreField> changedScores,
                                       TrackedStatus oldStatus, TrackedStatus newStatus) {
        Set<String> required = new LinkedHashSet<>();
        for (ScoreField field : kind.getScoreFields()) {
            if (changedScores.contains(field)) {
                required.add(field.getReasonKey());
            }
        }
        if (newStatus != null && newStatus != oldStatus
            && kind.getStatusesRequiringRationale().contains(newStatus.getCode())) {
            required.add(ScoreField.STATUS_CHANGE_RATIONALE);
        }
        return required;
    }

    /**
     * Validates the supplied reasons and returns every non-blank reason the kind knows about,
     * trimmed, ready to attach to the version and audit entry.
     *
     * @throws ValidationException listing each missing reason key
     */
    public Map<String, String> enforce(EntityKind kind, ScorePair oldScores, ScorePair newScores,
                                       TrackedStatus oldStatus, TrackedStatus newStatus,
                                       Map<String, String> suppliedReasons) {
        Set<String> required = requiredReasons(kind, changedScores(kind, oldScores, newScores), oldStatus, newStatus);
        Map<String, String> reasons = acceptedReasons(kind, suppliedReasons);

        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (String key : required) {
            if (!reasons.containsKey(key)) {
                missing.put(key, List.of("is required for this change"));
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Rejected {} change: missing {}", kind.getDisplayName(), missing.keySet());
            meterRegistry.counter("register.rationale.rejections", "kind", kind.name().toLowerCase()).increment();
            throw new ValidationException(ErrorCode.VALIDATION_RATIONALE_REQUIRED,
                "Missing change rationale: " + String.join(", ", missing.keySet()), missing);
        }
        return reasons;
    }

    public static Set<ScoreField> changedScores(EntityKind kind, ScorePair oldScores, ScorePair newScores) {
        Set<ScoreField> changed = new LinkedHashSet<>();
        List<ScoreField> fields = kind.getScoreFields();
        if (fields.size() == 1) {
            if (oldScores.second() != newScores.second()) {
                changed.add(fields.get(0));
            }
            return changed;
        }
        if (oldScores.first() != newScores.first()) {
            changed.add(fields.get(0));
        }
        if (oldScores.second() != newScores.second()) {
            changed.add(fields.get(1));
        }
        return changed;
    }

    private static Map<String, String> acceptedReasons(EntityKind kind, Map<String, String> supplied) {
        Map<String, String> reasons = new LinkedHashMap<>();
        if (supplied == null) {
            return reasons;
        }
        for (ScoreField field : kind.getScoreFields()) {
            putIfPresent(reasons, field.getReasonKey(), supplied.get(field.getReasonKey()));
        }
        putIfPresent(reasons, ScoreField.STATUS_CHANGE_RATIONALE, supplied.get(ScoreField.STATUS_CHANGE_RATIONALE));
        return reasons;
    }

    private static void putIfPresent(Map<String, String> reasons, String key, String value) {
        if (value != null && !value.isBlank()) {
            reasons.put(key, value.trim());
        }
    }
}
