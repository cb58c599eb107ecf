package com.riskledger.register.dto;

import com.riskledger.register.domain.MitigationStrategy;
import com.riskledger.register.domain.RiskStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRiskRequest {

    @NotNull
    private UUID organizationalUnitId;

    @NotBlank
    private String riskName;

    @NotBlank
    private String riskCondition;

    @NotBlank
    private String riskIf;

    @NotBlank
    private String riskThen;

    private String category;

    /**
     * 1-5, clamped; defaults to 3.
     */
    private Integer likelihood;

    /**
     * 1-5, clamped; defaults to 3.
     */
    private Integer consequence;

    private MitigationStrategy mitigationStrategy;
    private String mitigationPlan;
    private String owner;
    private RiskStatus status;
}
