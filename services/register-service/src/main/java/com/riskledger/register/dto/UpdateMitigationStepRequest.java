package com.riskledger.register.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateMitigationStepRequest extends StepUpdateRequest {

    private String mitigationActions;
    private String closureCriteria;
    private Integer expectedLikelihood;
    private Integer expectedConsequence;
    private Integer actualLikelihood;
    private Integer actualConsequence;

    public void setActualLikelihood(Integer actualLikelihood) {
        this.actualLikelihood = actualLikelihood;
        markPresent("actualLikelihood");
    }

    public void setActualConsequence(Integer actualConsequence) {
        this.actualConsequence = actualConsequence;
        markPresent("actualConsequence");
    }
}
