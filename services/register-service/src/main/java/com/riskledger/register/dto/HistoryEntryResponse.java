package com.riskledger.register.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One version in a record's history; step versions carry the step id and 1-based position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryEntryResponse {

    private RecordScope type;
    private UUID ownerId;
    private UUID stepId;
    private Integer stepNumber;
    private int version;
    private Map<String, Object> snapshot;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> changeReasons;

    private Instant createdAt;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean synthetic;

    public static HistoryEntryResponse from(RecordVersion version) {
        boolean step = version.getScope() == RecordScope.STEP;
        return HistoryEntryResponse.builder()
            .type(version.getScope())
            .ownerId(version.getRecordId())
            .stepId(step ? version.getOwnerId() : null)
            .stepNumber(version.getStepNumber())
            .version(version.getVersion())
            .snapshot(version.getSnapshot())
            .changeReasons(version.getChangeReasons())
            .createdAt(version.getCreatedAt())
            .synthetic(version.isSynthetic())
            .build();
    }
}
