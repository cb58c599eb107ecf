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
@Table(name = "action_plan_steps", indexes = {
    @Index(name = "idx_action_plan_steps_record", columnList = "record_id, sequence_order")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class ActionPlanStep extends AbstractStep {

    @Column(name = "planned_action", nullable = false, length = 4000)
    private String plannedAction;

    @Column(name = "expected_likelihood", nullable = false)
    private int expectedLikelihood;

    @Column(name = "expected_impact", nullable = false)
    private int expectedImpact;

    @Column(name = "actual_likelihood")
    private Integer actualLikelihood;

    @Column(name = "actual_impact")
    private Integer actualImpact;

    @Override
    public EntityKind getKind() {
        return EntityKind.OPPORTUNITY;
    }

    @Override
    public String getActionSummary() {
        return plannedAction;
    }

    @Override
    protected Map<ScoreField, Integer> expectedScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.LIKELIHOOD, expectedLikelihood);
        scores.put(ScoreField.IMPACT, expectedImpact);
        return scores;
    }

    @Override
    protected Map<ScoreField, Integer> actualScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.LIKELIHOOD, actualLikelihood);
        scores.put(ScoreField.IMPACT, actualImpact);
        return scores;
    }

    @Override
    protected Map<String, Object> actionFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("plannedAction", plannedAction);
        return fields;
    }
}
