package com.riskledger.register.dto;

import com.riskledger.register.domain.OpportunityStatus;
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
public class CreateOpportunityRequest {

    @NotNull
    private UUID organizationalUnitId;

    @NotBlank
    private String opportunityName;

    @NotBlank
    private String opportunityCondition;

    @NotBlank
    private String opportunityIf;

    @NotBlank
    private String opportunityThen;

    private String category;
    private Integer likelihood;
    private Integer impact;
    private String owner;
    private OpportunityStatus status;
}
