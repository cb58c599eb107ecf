package com.riskledger.register.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.TrackedRecord;
import com.riskledger.register.level.ScorePair;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A risk, issue or opportunity as the register shows it. The versioned fields of the record
 * are written at the top level, e.g. {@code riskName} or {@code issueLevel}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordResponse {

    private UUID id;
    private UUID organizationalUnitId;
    private Integer levelRank;
    private String statusChangeRationale;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUpdated;
    private List<StepResponse> steps;

    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public static RecordResponse from(TrackedRecord record) {
        return RecordResponse.builder()
            .id(record.getId())
            .organizationalUnitId(record.getOrganizationalUnitId())
            .levelRank(record.getLevelRank())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .lastUpdated(record.getUpdatedAt())
            .fields(record.toSnapshot())
            .build();
    }

    /**
     * Adds the version 1 scores as {@code originalLikelihood} and the like.
     */
    public RecordResponse withOriginalScores(EntityKind kind, ScorePair original) {
        if (original != null) {
            kind.scoreValues(original).forEach((name, value) ->
                fields.put("original" + Character.toUpperCase(name.charAt(0)) + name.substring(1), value));
        }
        return this;
    }
}
