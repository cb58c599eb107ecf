package com.riskledger.register.dto;

import com.riskledger.register.domain.IssueStatus;
import com.riskledger.register.domain.ScoreField;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
public class UpdateIssueRequest extends PatchRequest {

    private String issueName;
    private String description;
    private Integer consequence;
    private String owner;
    private String category;
    private IssueStatus status;

    private String consequenceChangeReason;
    private String statusChangeRationale;

    public void setDescription(String description) {
        this.description = description;
        markPresent("description");
    }

    public void setOwner(String owner) {
        this.owner = owner;
        markPresent("owner");
    }

    public void setCategory(String category) {
        this.category = category;
        markPresent("category");
    }

    public Map<String, String> changeReasons() {
        return reasons(
            ScoreField.CONSEQUENCE.getReasonKey(), consequenceChangeReason,
            ScoreField.STATUS_CHANGE_RATIONALE, statusChangeRationale);
    }
}
