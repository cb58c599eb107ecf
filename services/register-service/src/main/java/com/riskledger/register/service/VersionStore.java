package com.riskledger.register.service;

import com.riskledger.register.config.RegisterProperties;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.TrackedRecord;
import com.riskledger.register.level.ScorePair;
import com.riskledger.register.repository.RecordVersionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only store of record and step snapshots.
 *
 * <p>Appends join the caller's transaction, so the version number is computed in the same unit of
 * work as the state it snapshots. The unique constraint on (owner, version) turns a concurrent
 * duplicate into a failed commit.
 */
@Slf4j
@Service
public class VersionStore {

    private final RecordVersionRepository versionRepository;
    private final RegisterProperties properties;
    private final TransactionTemplate backfillTransaction;

    public VersionStore(RecordVersionRepository versionRepository,
                        RegisterProperties properties,
                        PlatformTransactionManager transactionManager) {
        this.versionRepository = versionRepository;
        this.properties = properties;
        this.backfillTransaction = new TransactionTemplate(transactionManager);
        this.backfillTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Appends the next version for the owner. The stored timestamp is {@code requestedAt}, moved
     * forward by a millisecond past the previous version when needed so timestamps stay strictly
     * increasing per owner.
     */
    @Transactional
    public RecordVersion appendVersion(RecordScope scope, EntityKind kind, UUID ownerId, UUID recordId,
                                       Map<String, Object> snapshot, Map<String, String> reasons,
                                       Instant requestedAt) {
        Optional<RecordVersion> previous = versionRepository.findTopByOwnerIdOrderByVersionDesc(ownerId);
        int version = (int) versionRepository.countByOwnerId(ownerId) + 1;

        Instant createdAt = requestedAt;
        if (previous.isPresent() && !createdAt.isAfter(previous.get().getCreatedAt())) {
            createdAt = previous.get().getCreatedAt().plus(1, ChronoUnit.MILLIS);
        }

        RecordVersion saved = versionRepository.save(RecordVersion.builder()
            .ownerId(ownerId)
            .recordId(recordId)
            .scope(scope)
            .entityKind(kind)
            .version(version)
            .snapshot(SnapshotValues.toJson(snapshot))
            .changeReasons(reasons != null ? new LinkedHashMap<>(reasons) : new LinkedHashMap<>())
            .createdAt(createdAt)
            .build());

        log.debug("Appended {} {} version {} for {}", kind, scope, version, ownerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RecordVersion> listVersions(UUID ownerId) {
        return versionRepository.findByOwnerIdOrderByVersionAsc(ownerId);
    }

    @Transactional(readOnly = true)
    public List<RecordVersion> listStepVersions(UUID recordId) {
        return versionRepository.findByRecordIdAndScopeOrderByCreatedAtAscVersionAsc(recordId, RecordScope.STEP);
    }

    /**
     * Entity versions of the record, creating version 1 from the current state first when the
     * record has none. Never fails because of the backfill itself.
     */
    public List<RecordVersion> versionsWithBackfill(TrackedRecord record) {
        List<RecordVersion> versions = versionRepository.findByOwnerIdOrderByVersionAsc(record.getId());
        if (!versions.isEmpty() || !Boolean.TRUE.equals(properties.getVersioning().getBackfillOnRead())) {
            return versions;
        }
        return List.of(backfillInitialVersion(record));
    }

    /**
     * Persists version 1 for a record without versions in its own transaction. A unique-constraint
     * conflict means another reader backfilled first and the stored row is returned. Any other
     * failure yields an unsaved synthetic version dated at the record's creation.
     */
    public RecordVersion backfillInitialVersion(TrackedRecord record) {
        RecordVersion initial = initialVersionOf(record);
        try {
            RecordVersion saved = backfillTransaction.execute(status -> versionRepository.saveAndFlush(initial));
            log.info("Backfilled version 1 for {} {}", record.getKind().getDisplayName(), record.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("Version 1 of {} {} already backfilled, re-reading", record.getKind().getDisplayName(), record.getId());
            return versionRepository.findByOwnerIdAndVersion(record.getId(), 1)
                .orElseGet(() -> synthetic(record));
        } catch (DataAccessException e) {
            log.warn("Backfill of version 1 for {} {} failed, serving synthetic snapshot",
                record.getKind().getDisplayName(), record.getId(), e);
            return synthetic(record);
        }
    }

    @Transactional(readOnly = true)
    public boolean hasVersions(UUID ownerId) {
        return versionRepository.existsByOwnerId(ownerId);
    }

    /**
     * Scores of version 1, or the current scores when no version exists.
     */
    @Transactional(readOnly = true)
    public ScorePair originalScores(TrackedRecord record) {
        return versionRepository.findByOwnerIdAndVersion(record.getId(), 1)
            .map(version -> record.getKind().scoresOf(version.getSnapshot()))
            .orElseGet(record::getScores);
    }

    @Transactional(readOnly = true)
    public Map<UUID, ScorePair> originalScores(EntityKind kind, Collection<UUID> ownerIds) {
        if (ownerIds.isEmpty()) {
            return Map.of();
        }
        return versionRepository.findByOwnerIdInAndVersion(ownerIds, 1).stream()
            .collect(Collectors.toMap(RecordVersion::getOwnerId, version -> kind.scoresOf(version.getSnapshot())));
    }

    /**
     * Most recent status rationale of each owner, newest version first.
     */
    @Transactional(readOnly = true)
    public Map<UUID, String> latestStatusRationales(Collection<UUID> ownerIds, String rationaleKey) {
        Map<UUID, String> rationales = new LinkedHashMap<>();
        if (ownerIds.isEmpty()) {
            return rationales;
        }
        List<RecordVersion> versions = versionRepository.findByOwnerIdInOrderByCreatedAtAscVersionAsc(ownerIds);
        for (RecordVersion version : versions) {
            String rationale = version.getChangeReasons().get(rationaleKey);
            if (rationale != null) {
                rationales.put(version.getOwnerId(), rationale);
            }
        }
        return rationales;
    }

    @Transactional
    public int purge(UUID recordId) {
        return versionRepository.deleteByRecordId(recordId);
    }

    private RecordVersion initialVersionOf(TrackedRecord record) {
        return RecordVersion.builder()
            .ownerId(record.getId())
            .recordId(record.getId())
            .scope(RecordScope.ENTITY)
            .entityKind(record.getKind())
            .version(1)
            .snapshot(SnapshotValues.toJson(record.toSnapshot()))
            .changeReasons(new LinkedHashMap<>())
            .createdAt(record.getCreatedAt())
            .build();
    }

    private RecordVersion synthetic(TrackedRecord record) {
        RecordVersion version = initialVersionOf(record);
        version.setSynthetic(true);
        return version;
    }
}
