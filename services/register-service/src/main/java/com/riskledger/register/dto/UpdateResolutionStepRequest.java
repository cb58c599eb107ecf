package com.riskledger.register.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateResolutionStepRequest extends StepUpdateRequest {

    private String plannedAction;
    private Integer expectedConsequence;
    private Integer actualConsequence;

    public void setActualConsequence(Integer actualConsequence) {
        this.actualConsequence = actualConsequence;
        markPresent("actualConsequence");
    }
}
