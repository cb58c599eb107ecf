package com.riskledger.register.service;

import com.riskledger.register.domain.AuditAction;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.TrackedRecord;
import com.riskledger.register.domain.TrackedStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Map;

/**
 * Appends the version and then the audit entry of a mutation, in the caller's transaction.
 * Both carry the version's timestamp.
 */
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class ChangeCaptureService {

    private final VersionStore versionStore;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * Current time at the precision versions are stored with.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public RecordVersion recordCreated(TrackedRecord record) {
        RecordVersion version = appendEntityVersion(record, Map.of());
        auditLogService.recordMutation(record.getId(), record.getKind(), RecordScope.ENTITY, record.getId(),
            AuditAction.CREATED, null, null, null, null, version.getCreatedAt());
        return version;
    }

    public RecordVersion recordUpdated(TrackedRecord record, Map<String, Object> before, Map<String, String> reasons) {
        RecordVersion version = appendEntityVersion(record, reasons);
        auditLogService.recordMutation(record.getId(), record.getKind(), RecordScope.ENTITY, record.getId(),
            AuditAction.UPDATED, before, record.toSnapshot(), reasons, null, version.getCreatedAt());
        return version;
    }

    public void recordDeleted(TrackedRecord record) {
        auditLogService.recordMutation(record.getId(), record.getKind(), RecordScope.ENTITY, record.getId(),
            AuditAction.DELETED, null, null, null, null, now());
    }

    public RecordVersion stepCreated(TrackedStep step) {
        RecordVersion version = appendStepVersion(step);
        auditLogService.recordMutation(step.getRecordId(), step.getKind(), RecordScope.STEP, step.getId(),
            AuditAction.CREATED, null, null, null, step.getStepNumber(), version.getCreatedAt());
        return version;
    }

    public RecordVersion stepUpdated(TrackedStep step, Map<String, Object> before) {
        RecordVersion version = appendStepVersion(step);
        auditLogService.recordMutation(step.getRecordId(), step.getKind(), RecordScope.STEP, step.getId(),
            AuditAction.UPDATED, before, step.toSnapshot(), null, step.getStepNumber(), version.getCreatedAt());
        return version;
    }

    public void stepDeleted(TrackedStep step) {
        auditLogService.recordMutation(step.getRecordId(), step.getKind(), RecordScope.STEP, step.getId(),
            AuditAction.DELETED, null, null, null, step.getStepNumber(), now());
    }

    /**
     * Versions steps whose position changed as a side effect of another step mutation.
     */
    public void stepsMoved(Collection<? extends TrackedStep> moved) {
        moved.forEach(this::appendStepVersion);
    }

    public void stepsReordered(TrackedRecord record, Collection<? extends TrackedStep> moved,
                               String fromOrder, String toOrder) {
        stepsMoved(moved);
        auditLogService.recordReorder(record.getId(), record.getKind(), fromOrder, toOrder, now());
    }

    private RecordVersion appendEntityVersion(TrackedRecord record, Map<String, String> reasons) {
        return versionStore.appendVersion(RecordScope.ENTITY, record.getKind(), record.getId(), record.getId(),
            record.toSnapshot(), reasons, now());
    }

    private RecordVersion appendStepVersion(TrackedStep step) {
        return versionStore.appendVersion(RecordScope.STEP, step.getKind(), step.getId(), step.getRecordId(),
            step.toSnapshot(), null, now());
    }
}
