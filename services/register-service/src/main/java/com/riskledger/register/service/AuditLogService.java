package com.riskledger.register.service;

import com.riskledger.register.domain.AuditAction;
import com.riskledger.register.domain.AuditLogEntry;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.audit.AuditDetails;
import com.riskledger.register.domain.audit.CreatedDetails;
import com.riskledger.register.domain.audit.DeletedDetails;
import com.riskledger.register.domain.audit.FieldChange;
import com.riskledger.register.domain.audit.UpdatedDetails;
import com.riskledger.register.repository.AuditLogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Writes one audit entry per mutation and serves a record's audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class AuditLogService {

    private static final Set<String> STEP_IGNORED_FIELDS = Set.of("sequenceOrder");

    private final AuditLogEntryRepository auditLogEntryRepository;

    /**
     * Records a mutation. For updates the details carry the fields whose values differ between
     * {@code oldState} and {@code newState}; derived level fields are not audited.
     *
     * @param recordId   top-level record, also for step mutations
     * @param stepNumber 1-based step position for step mutations, otherwise null
     */
    public AuditLogEntry recordMutation(UUID recordId, EntityKind kind, RecordScope entityType, UUID entityId,
                                        AuditAction action, Map<String, Object> oldState,
                                        Map<String, Object> newState, Map<String, String> reasons,
                                        Integer stepNumber, Instant at) {
        AuditDetails details = switch (action) {
            case CREATED -> new CreatedDetails(stepNumber);
            case DELETED -> new DeletedDetails(stepNumber);
            case UPDATED -> new UpdatedDetails(stepNumber,
                AuditDiff.diff(oldState, newState, ignoredFields(kind, entityType)), reasons);
        };
        return append(recordId, kind, entityType, entityId, details, at);
    }

    /**
     * Records a reorder of the record's steps as a single entity-level update.
     */
    public AuditLogEntry recordReorder(UUID recordId, EntityKind kind, String fromOrder, String toOrder, Instant at) {
        UpdatedDetails details = new UpdatedDetails(null,
            Map.of(kind.getReorderField(), new FieldChange(fromOrder, toOrder)), null);
        return append(recordId, kind, RecordScope.ENTITY, recordId, details, at);
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> listForRecord(UUID recordId) {
        return auditLogEntryRepository.findByRecordIdOrderByCreatedAtDesc(recordId);
    }

    public int purge(UUID recordId) {
        return auditLogEntryRepository.deleteByRecordId(recordId);
    }

    private AuditLogEntry append(UUID recordId, EntityKind kind, RecordScope entityType, UUID entityId,
                                 AuditDetails details, Instant at) {
        AuditLogEntry entry = AuditLogEntry.builder()
            .recordId(recordId)
            .entityKind(kind)
            .entityType(entityType)
            .entityId(entityId)
            .action(details.getAction())
            .details(details)
            .createdAt(at)
            .build();

        AuditLogEntry saved = auditLogEntryRepository.save(entry);
        log.info("Audit {} {} {} {} of record {}", kind.getDisplayName(), entityType.getCode(),
            entityId, details.getAction().getCode(), recordId);
        return saved;
    }

    private static Set<String> ignoredFields(EntityKind kind, RecordScope entityType) {
        return entityType == RecordScope.STEP ? STEP_IGNORED_FIELDS : Set.of(kind.getLevelField());
    }
}
