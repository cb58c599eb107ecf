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
@Table(name = "mitigation_steps", indexes = {
    @Index(name = "idx_mitigation_steps_record", columnList = "record_id, sequence_order")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class MitigationStep extends AbstractStep {

    @Column(name = "mitigation_actions", nullable = false, length = 4000)
    private String mitigationActions;

    @Column(name = "closure_criteria", nullable = false, length = 4000)
    private String closureCriteria;

    @Column(name = "expected_likelihood", nullable = false)
    private int expectedLikelihood;

    @Column(name = "expected_consequence", nullable = false)
    private int expectedConsequence;

    @Column(name = "actual_likelihood")
    private Integer actualLikelihood;

    @Column(name = "actual_consequence")
    private Integer actualConsequence;

    @Override
    public EntityKind getKind() {
        return EntityKind.RISK;
    }

    @Override
    public String getActionSummary() {
        return mitigationActions;
    }

    @Override
    protected Map<ScoreField, Integer> expectedScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.LIKELIHOOD, expectedLikelihood);
        scores.put(ScoreField.CONSEQUENCE, expectedConsequence);
        return scores;
    }

    @Override
    protected Map<ScoreField, Integer> actualScoreValues() {
        Map<ScoreField, Integer> scores = new LinkedHashMap<>();
        scores.put(ScoreField.LIKELIHOOD, actualLikelihood);
        scores.put(ScoreField.CONSEQUENCE, actualConsequence);
        return scores;
    }

    @Override
    protected Map<String, Object> actionFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("mitigationActions", mitigationActions);
        fields.put("closureCriteria", closureCriteria);
        return fields;
    }
}
