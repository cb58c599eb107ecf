package com.riskledger.register.dto;

import com.riskledger.register.domain.IssueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * New issue. With {@code sourceRiskId} set, the unit and any omitted narrative fields are taken
 * from that realized risk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIssueRequest {

    private UUID organizationalUnitId;
    private String issueName;
    private String description;
    private Integer consequence;
    private String owner;
    private String category;
    private IssueStatus status;
    private UUID sourceRiskId;
}
