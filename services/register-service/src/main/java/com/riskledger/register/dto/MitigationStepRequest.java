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
public class MitigationStepRequest {

    /**
     * Zero-based position; appended at the end when omitted.
     */
    private Integer sequenceOrder;

    @NotBlank
    private String mitigationActions;

    @NotBlank
    private String closureCriteria;

    private LocalDate estimatedStartDate;
    private LocalDate estimatedEndDate;

    @NotNull
    private Integer expectedLikelihood;

    @NotNull
    private Integer expectedConsequence;

    private Integer actualLikelihood;
    private Integer actualConsequence;
    private Instant actualCompletedAt;
}
