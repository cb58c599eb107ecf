package com.riskledger.register.dto;

import com.riskledger.register.domain.MitigationStrategy;
import com.riskledger.register.domain.RiskStatus;
import com.riskledger.register.domain.ScoreField;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
public class UpdateRiskRequest extends PatchRequest {

    private String riskName;
    private String riskCondition;
    private String riskIf;
    private String riskThen;
    private String category;
    private Integer likelihood;
    private Integer consequence;
    private MitigationStrategy mitigationStrategy;
    private String mitigationPlan;
    private String owner;
    private RiskStatus status;

    private String likelihoodChangeReason;
    private String consequenceChangeReason;
    private String statusChangeRationale;

    public void setCategory(String category) {
        this.category = category;
        markPresent("category");
    }

    public void setMitigationStrategy(MitigationStrategy mitigationStrategy) {
        this.mitigationStrategy = mitigationStrategy;
        markPresent("mitigationStrategy");
    }

    public void setMitigationPlan(String mitigationPlan) {
        this.mitigationPlan = mitigationPlan;
        markPresent("mitigationPlan");
    }

    public void setOwner(String owner) {
        this.owner = owner;
        markPresent("owner");
    }

    public Map<String, String> changeReasons() {
        return reasons(
            ScoreField.LIKELIHOOD.getReasonKey(), likelihoodChangeReason,
            ScoreField.CONSEQUENCE.getReasonKey(), consequenceChangeReason,
            ScoreField.STATUS_CHANGE_RATIONALE, statusChangeRationale);
    }
}
