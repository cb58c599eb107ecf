package com.riskledger.register.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * New resolution step. The action defaults to "Resolution step" and the expected consequence
 * to the issue's current consequence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionStepRequest {

    private Integer sequenceOrder;
    private String plannedAction;
    private LocalDate estimatedStartDate;
    private LocalDate estimatedEndDate;
    private Integer expectedConsequence;
    private Integer actualConsequence;
    private Instant actualCompletedAt;
}
