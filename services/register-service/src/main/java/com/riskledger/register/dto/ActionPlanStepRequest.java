package com.riskledger.register.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionPlanStepRequest {

    private Integer sequenceOrder;

    @NotBlank
    private String plannedAction;

    private LocalDate estimatedStartDate;
    private LocalDate estimatedEndDate;

    @NotNull
    private Integer expectedLikelihood;

    @NotNull
    private Integer expectedImpact;

    private Integer actualLikelihood;
    private Integer actualImpact;
    private Instant actualCompletedAt;
}
