package com.riskledger.register.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskledger.register.domain.AbstractStep;
import com.riskledger.register.level.Level;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A step with its versioned fields flattened next to the derived expected and actual levels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepResponse {

    private UUID id;
    private UUID recordId;
    private int stepNumber;
    private Level expectedLevel;
    private Integer expectedRank;
    private Level actualLevel;
    private Integer actualRank;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public static StepResponse from(AbstractStep step) {
        return StepResponse.builder()
            .id(step.getId())
            .recordId(step.getRecordId())
            .stepNumber(step.getStepNumber())
            .expectedLevel(step.getExpectedLevel())
            .expectedRank(step.getExpectedRank())
            .actualLevel(step.getActualLevel())
            .actualRank(step.getActualRank())
            .createdAt(step.getCreatedAt())
            .updatedAt(step.getUpdatedAt())
            .fields(step.toSnapshot())
            .build();
    }
}
