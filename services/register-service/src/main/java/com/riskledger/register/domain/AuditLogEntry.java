package com.riskledger.register.domain;

import com.riskledger.register.domain.audit.AuditDetails;
import com.riskledger.register.domain.audit.AuditDetailsConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry per mutation of a record or one of its steps. Append-only.
 */
@Entity
@Table(name = "register_audit_log", indexes = {
    @Index(name = "idx_register_audit_record_time", columnList = "record_id, created_at"),
    @Index(name = "idx_register_audit_entity", columnList = "entity_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Top-level record, also for step-scoped entries.
     */
    @Column(name = "record_id", nullable = false, updatable = false)
    private UUID recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, updatable = false, length = 16)
    private EntityKind entityKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 16)
    private RecordScope entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 16)
    private AuditAction action;

    @Convert(converter = AuditDetailsConverter.class)
    @Column(name = "details", updatable = false, columnDefinition = "TEXT")
    private AuditDetails details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
