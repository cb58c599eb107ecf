package com.riskledger.register.domain;

import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.register.level.LevelAssessment;
import com.riskledger.register.level.LevelMatrix;
import com.riskledger.register.level.ScorePair;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-kind descriptor of a tracked record: which scores it carries, which statuses
 * are gated behind a rationale, how its level is classified and how its steps are named.
 *
 * <p>Versioning, diffing and rationale checks are written once against this descriptor.
 */
public enum EntityKind {

    RISK("Risk", "risks", "riskLevel", LevelMatrix.RISK,
        List.of(ScoreField.LIKELIHOOD, ScoreField.CONSEQUENCE), RiskStatus.values(),
        "Mitigation step", "mitigation", CategoryScheme.RISK),

    ISSUE("Issue", "issues", "issueLevel", LevelMatrix.ISSUE,
        List.of(ScoreField.CONSEQUENCE), IssueStatus.values(),
        "Resolution step", "resolution", CategoryScheme.RISK),

    OPPORTUNITY("Opportunity", "opportunities", "opportunityLevel", LevelMatrix.OPPORTUNITY,
        List.of(ScoreField.LIKELIHOOD, ScoreField.IMPACT), OpportunityStatus.values(),
        "Action plan step", "actionPlan", CategoryScheme.OPPORTUNITY);

    private final String displayName;
    private final String collection;
    private final String levelField;
    private final LevelMatrix levelMatrix;
    private final List<ScoreField> scoreFields;
    private final Set<String> statusesRequiringRationale;
    private final String stepDisplayName;
    private final String stepKey;
    private final CategoryScheme categoryScheme;

    EntityKind(String displayName, String collection, String levelField, LevelMatrix levelMatrix,
               List<ScoreField> scoreFields, TrackedStatus[] statuses,
               String stepDisplayName, String stepKey, CategoryScheme categoryScheme) {
        this.displayName = displayName;
        this.collection = collection;
        this.levelField = levelField;
        this.levelMatrix = levelMatrix;
        this.scoreFields = scoreFields;
        Set<String> gated = Arrays.stream(statuses)
            .filter(TrackedStatus::isRationaleRequired)
            .map(TrackedStatus::getCode)
            .collect(Collectors.toCollection(LinkedHashSet<String>::new));
        this.statusesRequiringRationale = Collections.unmodifiableSet(gated);
        this.stepDisplayName = stepDisplayName;
        this.stepKey = stepKey;
        this.categoryScheme = categoryScheme;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCollection() {
        return collection;
    }

    /**
     * Snapshot key holding the level code, e.g. {@code riskLevel}.
     */
    public String getLevelField() {
        return levelField;
    }

    public List<ScoreField> getScoreFields() {
        return scoreFields;
    }

    public Set<String> getStatusesRequiringRationale() {
        return statusesRequiringRationale;
    }

    public String getStepDisplayName() {
        return stepDisplayName;
    }

    public CategoryScheme getCategoryScheme() {
        return categoryScheme;
    }

    /**
     * Audit field recorded when the steps of a record are reordered.
     */
    public String getReorderField() {
        return stepKey + "StepsReordered";
    }

    public LevelAssessment classify(ScorePair scores) {
        return levelMatrix.classify(scores);
    }

    /**
     * Builds the score pair for this kind from named score values. Missing values default to 3.
     */
    public ScorePair scorePair(Function<ScoreField, Integer> scores) {
        if (scoreFields.size() == 1) {
            return new ScorePair(1, ScorePair.clampOrDefault(scores.apply(scoreFields.get(0))));
        }
        return new ScorePair(
            ScorePair.clampOrDefault(scores.apply(scoreFields.get(0))),
            ScorePair.clampOrDefault(scores.apply(scoreFields.get(1))));
    }

    /**
     * Reads the scores of this kind out of a version snapshot.
     */
    public ScorePair scoresOf(Map<String, ?> snapshot) {
        return scorePair(field -> asInteger(snapshot.get(field.getFieldName())));
    }

    /**
     * Reads a prefixed score set (e.g. {@code expectedLikelihood}) out of a step snapshot.
     * Returns null when any of the scores is absent.
     */
    public ScorePair prefixedScoresOf(Map<String, ?> snapshot, String prefix) {
        for (ScoreField field : scoreFields) {
            if (asInteger(snapshot.get(prefixed(prefix, field))) == null) {
                return null;
            }
        }
        return scorePair(field -> asInteger(snapshot.get(prefixed(prefix, field))));
    }

    /**
     * Named view of a score pair, e.g. {@code {likelihood=3, consequence=4}}.
     */
    public Map<String, Integer> scoreValues(ScorePair scores) {
        Map<String, Integer> values = new LinkedHashMap<>();
        if (scoreFields.size() == 1) {
            values.put(scoreFields.get(0).getFieldName(), scores.second());
            return values;
        }
        values.put(scoreFields.get(0).getFieldName(), scores.first());
        values.put(scoreFields.get(1).getFieldName(), scores.second());
        return values;
    }

    /**
     * Whether the register exposes the version 1 scores as original scores.
     */
    public boolean tracksOriginalScores() {
        return scoreFields.size() > 1;
    }

    public static String prefixed(String prefix, ScoreField field) {
        String name = field.getFieldName();
        return prefix + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static EntityKind fromCollection(String collection) {
        for (EntityKind kind : values()) {
            if (kind.collection.equalsIgnoreCase(collection)) {
                return kind;
            }
        }
        throw new ResourceNotFoundException("Unknown register: " + collection);
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return null;
    }
}
