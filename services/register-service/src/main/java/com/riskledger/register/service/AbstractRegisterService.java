package com.riskledger.register.service;

import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.common.error.ValidationException;
import com.riskledger.register.domain.AbstractStep;
import com.riskledger.register.domain.AbstractTrackedRecord;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.ScoreField;
import com.riskledger.register.domain.TrackedStatus;
import com.riskledger.register.dto.AuditLogEntryResponse;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.level.ScorePair;
import com.riskledger.register.repository.StepRepository;
import com.riskledger.register.repository.TrackedRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Create, update, delete and step handling shared by the risk, issue and opportunity registers.
 *
 * <p>Every mutation runs in one transaction: the rationale check comes first, then the record
 * write, then the version and the audit entry. A rejected request leaves no trace.
 *
 * @param <R> record entity
 * @param <S> step entity of the record
 */
@Slf4j
public abstract class AbstractRegisterService<R extends AbstractTrackedRecord, S extends AbstractStep> {

    protected final RegisterSupport support;
    private final TrackedRecordRepository<R> recordRepository;
    private final StepRepository<S> stepRepository;

    protected AbstractRegisterService(RegisterSupport support, TrackedRecordRepository<R> recordRepository,
                                      StepRepository<S> stepRepository) {
        this.support = support;
        this.recordRepository = recordRepository;
        this.stepRepository = stepRepository;
    }

    public abstract EntityKind kind();

    protected abstract List<R> findInUnit(UUID organizationalUnitId);

    // Records

    /**
     * Register listing of a unit, most recently updated first.
     */
    @Transactional(readOnly = true)
    public List<RecordResponse> list(UUID organizationalUnitId) {
        List<R> records = findInUnit(organizationalUnitId);
        List<UUID> ids = records.stream().map(AbstractTrackedRecord::getId).toList();

        Map<UUID, ScorePair> originals = kind().tracksOriginalScores()
            ? support.getVersionStore().originalScores(kind(), ids)
            : Map.of();
        Map<UUID, String> rationales = support.getVersionStore()
            .latestStatusRationales(ids, ScoreField.STATUS_CHANGE_RATIONALE);
        Map<UUID, Instant> stepUpdates = latestStepUpdates(ids);

        return records.stream()
            .map(record -> summarize(record, originals.get(record.getId()), rationales.get(record.getId()),
                stepUpdates.get(record.getId())))
            .toList();
    }

    /**
     * One record with its steps in order.
     */
    @Transactional(readOnly = true)
    public RecordResponse get(UUID id) {
        R record = require(id);
        List<S> steps = stepRepository.findByRecordIdOrderBySequenceOrderAsc(id);

        ScorePair original = kind().tracksOriginalScores()
            ? support.getVersionStore().originalScores(record)
            : null;
        String rationale = support.getVersionStore()
            .latestStatusRationales(List.of(id), ScoreField.STATUS_CHANGE_RATIONALE).get(id);
        Instant latestStep = steps.stream()
            .map(AbstractStep::getUpdatedAt)
            .max(Instant::compareTo)
            .orElse(null);

        RecordResponse response = summarize(record, original, rationale, latestStep);
        response.setSteps(steps.stream().map(StepResponse::from).toList());
        return response;
    }

    @Transactional
    public void delete(UUID id) {
        R record = require(id);
        stepRepository.deleteAll(stepRepository.findByRecordIdOrderBySequenceOrderAsc(id));
        recordRepository.delete(record);

        if (Boolean.TRUE.equals(support.getProperties().getRetention().getPurgeOnDelete())) {
            int versions = support.getVersionStore().purge(id);
            int entries = support.getAuditLogService().purge(id);
            log.info("Deleted {} {} and purged {} versions, {} audit entries",
                kind().getDisplayName(), id, versions, entries);
            return;
        }
        support.getChangeCapture().recordDeleted(record);
        log.info("Deleted {} {}", kind().getDisplayName(), id);
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntryResponse> auditLog(UUID id) {
        require(id);
        return support.getAuditLogService().listForRecord(id).stream()
            .map(AuditLogEntryResponse::from)
            .toList();
    }

    /**
     * Creates version 1 for every record of this kind that has none. Each backfill commits on its own.
     *
     * @return number of versions persisted
     */
    public int backfillVersions() {
        int backfilled = 0;
        for (R record : recordRepository.findAll()) {
            if (support.getVersionStore().hasVersions(record.getId())) {
                continue;
            }
            RecordVersion version = support.getVersionStore().backfillInitialVersion(record);
            if (!version.isSynthetic()) {
                backfilled++;
            }
        }
        log.info("Backfilled {} {} versions", backfilled, kind().getDisplayName());
        return backfilled;
    }

    protected R require(UUID id) {
        return recordRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(kind().getDisplayName(), id));
    }

    /**
     * Like {@link #require}, but holds the record's row lock until commit. Taken before any change
     * to the step order.
     */
    protected R requireForStepChange(UUID id) {
        return recordRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException(kind().getDisplayName(), id));
    }

    /**
     * Classifies and stores a new record, then writes version 1 and the created entry.
     */
    protected RecordResponse persistCreated(R record) {
        Instant now = support.getChangeCapture().now();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        record.reclassify();

        R saved = recordRepository.save(record);
        support.getChangeCapture().recordCreated(saved);
        log.info("Created {} {} '{}' at level {} (rank {})", kind().getDisplayName(), saved.getId(),
            saved.getName(), saved.getLevel().getCode(), saved.getLevelRank());

        return summarize(saved, kind().tracksOriginalScores() ? saved.getScores() : null, null, null);
    }

    /**
     * Runs the rationale check against the proposed scores and status, then applies
     * {@code changes} and writes the new version and audit entry.
     *
     * @param proposedScores scores the record will have after the update
     * @param proposedStatus status the record will have after the update
     * @param reasons        reason fields supplied with the request
     * @param changes        applies the request to the record
     */
    protected RecordResponse applyUpdate(UUID id, Function<R, ScorePair> proposedScores,
                                         Function<R, TrackedStatus> proposedStatus,
                                         Map<String, String> reasons, Consumer<R> changes) {
        R record = require(id);
        Map<String, String> accepted = support.getRationalePolicy().enforce(kind(),
            record.getScores(), proposedScores.apply(record),
            record.getStatus(), proposedStatus.apply(record), reasons);

        Map<String, Object> before = record.toSnapshot();
        changes.accept(record);
        record.reclassify();
        record.setUpdatedAt(support.getChangeCapture().now());

        R saved = recordRepository.save(record);
        RecordVersion version = support.getChangeCapture().recordUpdated(saved, before, accepted);
        log.info("Updated {} {} to version {}", kind().getDisplayName(), id, version.getVersion());

        return get(id);
    }

    // Steps

    @Transactional(readOnly = true)
    public List<StepResponse> listSteps(UUID recordId) {
        require(recordId);
        return stepRepository.findByRecordIdOrderBySequenceOrderAsc(recordId).stream()
            .map(StepResponse::from)
            .toList();
    }

    /**
     * Inserts a step at {@code requestedOrder}, or at the end when null, shifting later steps.
     */
    protected StepResponse persistStep(UUID recordId, S step, Integer requestedOrder) {
        requireForStepChange(recordId);
        List<S> current = stepRepository.findByRecordIdOrderBySequenceOrderAsc(recordId);
        Instant now = support.getChangeCapture().now();

        step.setRecordId(recordId);
        step.setCreatedAt(now);
        step.setUpdatedAt(now);
        step.reclassify();
        List<S> moved = StepSequencer.insert(current, step, requestedOrder);
        moved.forEach(other -> other.setUpdatedAt(now));

        S saved = stepRepository.save(step);
        stepRepository.saveAll(moved);
        support.getChangeCapture().stepCreated(saved);
        support.getChangeCapture().stepsMoved(moved);

        log.info("Added {} {} to {} {}", kind().getStepDisplayName(), saved.getStepNumber(),
            kind().getDisplayName(), recordId);
        return StepResponse.from(saved);
    }

    protected StepResponse applyStepUpdate(UUID recordId, UUID stepId, Consumer<S> changes) {
        require(recordId);
        S step = requireStep(recordId, stepId);

        Map<String, Object> before = step.toSnapshot();
        changes.accept(step);
        step.reclassify();
        step.setUpdatedAt(support.getChangeCapture().now());

        S saved = stepRepository.save(step);
        support.getChangeCapture().stepUpdated(saved, before);
        log.info("Updated {} {} of {} {}", kind().getStepDisplayName(), saved.getStepNumber(),
            kind().getDisplayName(), recordId);
        return StepResponse.from(saved);
    }

    @Transactional
    public void deleteStep(UUID recordId, UUID stepId) {
        requireForStepChange(recordId);
        S step = requireStep(recordId, stepId);
        support.getChangeCapture().stepDeleted(step);
        stepRepository.delete(step);

        List<S> remaining = new ArrayList<>(stepRepository.findByRecordIdOrderBySequenceOrderAsc(recordId));
        remaining.removeIf(other -> other.getId().equals(stepId));
        List<S> moved = StepSequencer.compact(remaining);
        Instant now = support.getChangeCapture().now();
        moved.forEach(other -> other.setUpdatedAt(now));
        stepRepository.saveAll(moved);
        support.getChangeCapture().stepsMoved(moved);

        log.info("Deleted {} {} of {} {}", kind().getStepDisplayName(), step.getStepNumber(),
            kind().getDisplayName(), recordId);
    }

    /**
     * Puts the record's steps in the order of {@code stepIds} and records one reorder entry.
     */
    @Transactional
    public List<StepResponse> reorderSteps(UUID recordId, List<UUID> stepIds) {
        R record = requireForStepChange(recordId);
        List<S> current = stepRepository.findByRecordIdOrderBySequenceOrderAsc(recordId);
        StepSequencer.Reorder<S> reorder = StepSequencer.reorder(current, stepIds);

        Instant now = support.getChangeCapture().now();
        reorder.moved().forEach(step -> step.setUpdatedAt(now));
        stepRepository.saveAll(reorder.moved());
        support.getChangeCapture().stepsReordered(record, reorder.moved(), reorder.fromOrder(), reorder.toOrder());

        log.info("Reordered {} steps of {} {}: [{}] -> [{}]", current.size(), kind().getDisplayName(), recordId,
            reorder.fromOrder(), reorder.toOrder());
        return stepRepository.findByRecordIdOrderBySequenceOrderAsc(recordId).stream()
            .map(StepResponse::from)
            .toList();
    }

    protected S requireStep(UUID recordId, UUID stepId) {
        return stepRepository.findByIdAndRecordId(stepId, recordId)
            .orElseThrow(() -> ResourceNotFoundException.step(kind().getStepDisplayName(), stepId));
    }

    protected static String requiredText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.requiredField(field);
        }
        return value.trim();
    }

    protected static String optionalText(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    protected static int scoreOr(Integer requested, int current) {
        return requested != null ? ScorePair.clamp(requested) : current;
    }

    protected static Integer clampOrNull(Integer score) {
        return score != null ? ScorePair.clamp(score) : null;
    }

    private RecordResponse summarize(R record, ScorePair original, String rationale, Instant latestStepUpdate) {
        RecordResponse response = RecordResponse.from(record);
        if (kind().tracksOriginalScores()) {
            response.withOriginalScores(kind(), original != null ? original : record.getScores());
        }
        if (record.getStatus().isRationaleRequired()) {
            response.setStatusChangeRationale(rationale);
        }
        if (latestStepUpdate != null && latestStepUpdate.isAfter(record.getUpdatedAt())) {
            response.setLastUpdated(latestStepUpdate);
        }
        return response;
    }

    private Map<UUID, Instant> latestStepUpdates(List<UUID> recordIds) {
        Map<UUID, Instant> latest = new HashMap<>();
        if (recordIds.isEmpty()) {
            return latest;
        }
        for (Object[] row : stepRepository.findLatestUpdateByRecordIds(recordIds)) {
            latest.put((UUID) row[0], (Instant) row[1]);
        }
        return latest;
    }
}
