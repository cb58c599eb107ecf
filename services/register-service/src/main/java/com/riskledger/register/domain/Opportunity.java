package com.riskledger.register.domain;

import com.riskledger.register.level.ScorePair;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "opportunities", indexes = {
    @Index(name = "idx_opportunities_org_unit", columnList = "organizational_unit_id")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class Opportunity extends AbstractTrackedRecord {

    @Column(name = "opportunity_name", nullable = false, length = 500)
    private String opportunityName;

    @Column(name = "opportunity_condition", nullable = false, length = 4000)
    private String opportunityCondition;

    @Column(name = "opportunity_if", nullable = false, length = 4000)
    private String opportunityIf;

    @Column(name = "opportunity_then", nullable = false, length = 4000)
    private String opportunityThen;

    @Builder.Default
    @Column(name = "likelihood", nullable = false)
    private int likelihood = ScorePair.DEFAULT_SCORE;

    @Builder.Default
    @Column(name = "impact", nullable = false)
    private int impact = ScorePair.DEFAULT_SCORE;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OpportunityStatus status = OpportunityStatus.PURSUE_NOW;

    @Override
    public EntityKind getKind() {
        return EntityKind.OPPORTUNITY;
    }

    @Override
    public String getName() {
        return opportunityName;
    }

    @Override
    public ScorePair getScores() {
        return new ScorePair(likelihood, impact);
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("opportunityName", opportunityName);
        snapshot.put("opportunityCondition", opportunityCondition);
        snapshot.put("opportunityIf", opportunityIf);
        snapshot.put("opportunityThen", opportunityThen);
        snapshot.put("category", getCategory());
        snapshot.put("likelihood", likelihood);
        snapshot.put("impact", impact);
        snapshot.put("opportunityLevel", getLevel() != null ? getLevel().getCode() : null);
        snapshot.put("owner", getOwner());
        snapshot.put("status", status.getCode());
        return snapshot;
    }
}
