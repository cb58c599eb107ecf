package com.riskledger.register.dto;

import com.riskledger.register.domain.OpportunityStatus;
import com.riskledger.register.domain.ScoreField;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
public class UpdateOpportunityRequest extends PatchRequest {

    private String opportunityName;
    private String opportunityCondition;
    private String opportunityIf;
    private String opportunityThen;
    private String category;
    private Integer likelihood;
    private Integer impact;
    private String owner;
    private OpportunityStatus status;

    private String likelihoodChangeReason;
    private String impactChangeReason;
    private String statusChangeRationale;

    public void setCategory(String category) {
        this.category = category;
        markPresent("category");
    }

    public void setOwner(String owner) {
        this.owner = owner;
        markPresent("owner");
    }

    public Map<String, String> changeReasons() {
        return reasons(
            ScoreField.LIKELIHOOD.getReasonKey(), likelihoodChangeReason,
            ScoreField.IMPACT.getReasonKey(), impactChangeReason,
            ScoreField.STATUS_CHANGE_RATIONALE, statusChangeRationale);
    }
}
