package com.riskledger.register.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "resolution_steps", indexes = {
    @Index(name = "idx_resolution_steps_record", columnList = "record_id, sequence_order")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class ResolutionStep extends AbstractStep {

    public static final String DEFAULT_ACTION = "Resolution step";

    @Column(name = "planned_action", nullable = false, length = 4000)
    private String plannedAction;

    @Column(name = "expected_consequence", nullable = false)
    private int expectedConsequence;

    @Column(name = "actual_consequence")
    private Integer actualConsequence;

    @Override
    public EntityKind getKind() {
        return EntityKind.ISSUE;
    }

    @Override
    public String getActionSummary() {
        return plannedAction;
    }

    @Override
    protected Map<ScoreField, Integer> expectedScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.CONSEQUENCE, expectedConsequence);
        return scores;
    }

    @Override
    protected Map<ScoreField, Integer> actualScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.CONSEQUENCE, actualConsequence);
        return scores;
    }

    @Override
    protected Map<String, Object> actionFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("plannedAction", plannedAction);
        return fields;
    }
}
