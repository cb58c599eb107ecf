package com.riskledger.register.domain;

import com.riskledger.register.level.Level;
import com.riskledger.register.level.LevelAssessment;
import com.riskledger.register.level.ScorePair;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Columns shared by mitigation, resolution and action plan steps.
 *
 * <p>Subclasses hold their own score columns and expose them through
 * {@link #expectedScoreValues()} and {@link #actualScoreValues()} keyed by {@link ScoreField}.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public abstract class AbstractStep implements TrackedStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "record_id", nullable = false, updatable = false)
    private UUID recordId;

    @Column(name = "sequence_order", nullable = false)
    private int sequenceOrder;

    @Column(name = "estimated_start_date")
    private LocalDate estimatedStartDate;

    @Column(name = "estimated_end_date")
    private LocalDate estimatedEndDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "expected_level", length = 16)
    private Level expectedLevel;

    @Column(name = "expected_rank")
    private Integer expectedRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "actual_level", length = 16)
    private Level actualLevel;

    @Column(name = "actual_rank")
    private Integer actualRank;

    @Column(name = "actual_completed_at")
    private Instant actualCompletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected abstract Map<ScoreField, Integer> expectedScoreValues();

    protected abstract Map<ScoreField, Integer> actualScoreValues();

    /**
     * Action text fields in snapshot order.
     */
    protected abstract Map<String, Object> actionFields();

    @Override
    public ScorePair getExpectedScores() {
        return getKind().scorePair(expectedScoreValues()::get);
    }

    @Override
    public ScorePair getActualScores() {
        Map<ScoreField, Integer> actual = actualScoreValues();
        if (actual.values().stream().anyMatch(value -> value == null)) {
            return null;
        }
        return getKind().scorePair(actual::get);
    }

    /**
     * Recomputes expected and actual level and rank. Actual values are cleared while
     * any actual score is missing.
     */
    public void reclassify() {
        LevelAssessment expected = getKind().classify(getExpectedScores());
        this.expectedLevel = expected.level();
        this.expectedRank = expected.rank();
        ScorePair actualScores = getActualScores();
        if (actualScores == null) {
            this.actualLevel = null;
            this.actualRank = null;
        } else {
            LevelAssessment actual = getKind().classify(actualScores);
            this.actualLevel = actual.level();
            this.actualRank = actual.rank();
        }
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("sequenceOrder", sequenceOrder);
        snapshot.putAll(actionFields());
        snapshot.put("estimatedStartDate", estimatedStartDate);
        snapshot.put("estimatedEndDate", estimatedEndDate);
        expectedScoreValues().forEach((field, value) ->
            snapshot.put(EntityKind.prefixed("expected", field), value));
        actualScoreValues().forEach((field, value) ->
            snapshot.put(EntityKind.prefixed("actual", field), value));
        snapshot.put("actualCompletedAt", actualCompletedAt);
        return snapshot;
    }
}
