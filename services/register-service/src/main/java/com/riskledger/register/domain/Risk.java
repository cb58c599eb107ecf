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
@Table(name = "risks", indexes = {
    @Index(name = "idx_risks_org_unit", columnList = "organizational_unit_id"),
    @Index(name = "idx_risks_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class Risk extends AbstractTrackedRecord {

    @Column(name = "risk_name", nullable = false, length = 500)
    private String riskName;

    @Column(name = "risk_condition", nullable = false, length = 4000)
    private String riskCondition;

    @Column(name = "risk_if", nullable = false, length = 4000)
    private String riskIf;

    @Column(name = "risk_then", nullable = false, length = 4000)
    private String riskThen;

    @Builder.Default
    @Column(name = "likelihood", nullable = false)
    private int likelihood = ScorePair.DEFAULT_SCORE;

    @Builder.Default
    @Column(name = "consequence", nullable = false)
    private int consequence = ScorePair.DEFAULT_SCORE;

    @Enumerated(EnumType.STRING)
    @Column(name = "mitigation_strategy", length = 32)
    private MitigationStrategy mitigationStrategy;

    @Column(name = "mitigation_plan", length = 4000)
    private String mitigationPlan;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private RiskStatus status = RiskStatus.OPEN;

    @Override
    public EntityKind getKind() {
        return EntityKind.RISK;
    }

    @Override
    public String getName() {
        return riskName;
    }

    @Override
    public ScorePair getScores() {
        return new ScorePair(likelihood, consequence);
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("riskName", riskName);
        snapshot.put("riskCondition", riskCondition);
        snapshot.put("riskIf", riskIf);
        snapshot.put("riskThen", riskThen);
        snapshot.put("category", getCategory());
        snapshot.put("likelihood", likelihood);
        snapshot.put("consequence", consequence);
        snapshot.put("riskLevel", getLevel() != null ? getLevel().getCode() : null);
        snapshot.put("mitigationStrategy", mitigationStrategy != null ? mitigationStrategy.getCode() : null);
        snapshot.put("mitigationPlan", mitigationPlan);
        snapshot.put("owner", getOwner());
        snapshot.put("status", status.getCode());
        return snapshot;
    }
}
