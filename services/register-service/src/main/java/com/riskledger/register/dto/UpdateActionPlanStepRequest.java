package com.riskledger.register.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateActionPlanStepRequest extends StepUpdateRequest {

    private String plannedAction;
    private Integer expectedLikelihood;
    private Integer expectedImpact;
    private Integer actualLikelihood;
    private Integer actualImpact;

    public void setActualLikelihood(Integer actualLikelihood) {
        this.actualLikelihood = actualLikelihood;
        markPresent("actualLikelihood");
    }

    public void setActualImpact(Integer actualImpact) {
        this.actualImpact = actualImpact;
        markPresent("actualImpact");
    }
}
