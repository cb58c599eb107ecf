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
import java.util.UUID;

/**
 * A problem that has already happened. Optionally raised from a realized risk.
 */
@Entity
@Table(name = "issues", indexes = {
    @Index(name = "idx_issues_org_unit", columnList = "organizational_unit_id"),
    @Index(name = "idx_issues_source_risk", columnList = "source_risk_id")
})
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class Issue extends AbstractTrackedRecord {

    @Column(name = "issue_name", nullable = false, length = 500)
    private String issueName;

    @Column(name = "description", length = 4000)
    private String description;

    @Builder.Default
    @Column(name = "consequence", nullable = false)
    private int consequence = ScorePair.DEFAULT_SCORE;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private IssueStatus status = IssueStatus.CONTROL;

    @Column(name = "source_risk_id")
    private UUID sourceRiskId;

    @Override
    public EntityKind getKind() {
        return EntityKind.ISSUE;
    }

    @Override
    public String getName() {
        return issueName;
    }

    @Override
    public ScorePair getScores() {
        return new ScorePair(1, consequence);
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("issueName", issueName);
        snapshot.put("description", description);
        snapshot.put("consequence", consequence);
        snapshot.put("issueLevel", getLevel() != null ? getLevel().getCode() : null);
        snapshot.put("owner", getOwner());
        snapshot.put("category", getCategory());
        snapshot.put("status", status.getCode());
        snapshot.put("sourceRiskId", sourceRiskId != null ? sourceRiskId.toString() : null);
        return snapshot;
    }
}
