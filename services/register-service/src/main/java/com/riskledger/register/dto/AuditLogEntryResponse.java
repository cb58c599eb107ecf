package com.riskledger.register.dto;

import com.riskledger.register.domain.AuditAction;
import com.riskledger.register.domain.AuditLogEntry;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.audit.AuditDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntryResponse {

    private UUID id;
    private UUID recordId;
    private RecordScope entityType;
    private UUID entityId;
    private AuditAction action;
    private AuditDetails details;
    private Instant createdAt;

    public static AuditLogEntryResponse from(AuditLogEntry entry) {
        return AuditLogEntryResponse.builder()
            .id(entry.getId())
            .recordId(entry.getRecordId())
            .entityType(entry.getEntityType())
            .entityId(entry.getEntityId())
            .action(entry.getAction())
            .details(entry.getDetails())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
