package com.riskledger.register.domain;

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
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of a record or step. Versions of one owner run 1..N without gaps;
 * the unique constraint rejects a second writer computing the same number.
 */
@Entity
@Table(name = "record_versions",
    uniqueConstraints = @UniqueConstraint(name = "uk_record_versions_owner_version",
        columnNames = {"owner_id", "version_number"}),
    indexes = {
        @Index(name = "idx_record_versions_record", columnList = "record_id, created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * The record or step this version snapshots.
     */
    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    /**
     * Top-level record; equal to ownerId for entity versions.
     */
    @Column(name = "record_id", nullable = false, updatable = false)
    private UUID recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, updatable = false, length = 16)
    private RecordScope scope;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, updatable = false, length = 16)
    private EntityKind entityKind;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int version;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "snapshot", nullable = false, updatable = false, columnDefinition = "TEXT")
    private Map<String, Object> snapshot = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = ReasonMapConverter.class)
    @Column(name = "change_reasons", updatable = false, columnDefinition = "TEXT")
    private Map<String, String> changeReasons = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Set on versions built in memory after a failed backfill; never persisted.
     */
    @Transient
    private boolean synthetic;

    public Integer getStepNumber() {
        if (scope != RecordScope.STEP) {
            return null;
        }
        Object order = snapshot.get("sequenceOrder");
        return order instanceof Number number ? number.intValue() + 1 : null;
    }
}
