package com.riskledger.register.service;

import com.riskledger.common.error.ErrorCode;
import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.register.domain.AbstractStep;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.TrackedRecord;
import com.riskledger.register.dto.HistoryEntryResponse;
import com.riskledger.register.dto.UnitWaterfallPoint;
import com.riskledger.register.dto.WaterfallResponse;
import com.riskledger.register.level.LevelAssessment;
import com.riskledger.register.level.ScorePair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Read side over the version streams: full and point-in-time history, and planned versus
 * actual waterfall series.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TemporalReconstructionService {

    /**
     * Ascending by time; at equal timestamps record versions precede step versions.
     */
    static final Comparator<RecordVersion> TIMELINE_ORDER = Comparator
        .comparing(RecordVersion::getCreatedAt)
        .thenComparing(RecordVersion::getScope);

    private final TrackedRecordRegistry registry;
    private final VersionStore versionStore;

    /**
     * Every record version and every step version of the record, merged into one timeline.
     * Versions of deleted steps are included.
     */
    public List<HistoryEntryResponse> history(EntityKind kind, UUID recordId) {
        TrackedRecord record = registry.requireRecord(kind, recordId);

        List<RecordVersion> timeline = new ArrayList<>(versionStore.versionsWithBackfill(record));
        timeline.addAll(versionStore.listStepVersions(recordId));
        timeline.sort(TIMELINE_ORDER);

        return timeline.stream().map(HistoryEntryResponse::from).toList();
    }

    /**
     * The record version that was current at {@code at}.
     *
     * @throws ResourceNotFoundException when {@code at} precedes the first version
     */
    public HistoryEntryResponse historyAt(EntityKind kind, UUID recordId, Instant at) {
        TrackedRecord record = registry.requireRecord(kind, recordId);

        return versionStore.versionsWithBackfill(record).stream()
            .filter(version -> !version.getCreatedAt().isAfter(at))
            .max(Comparator.comparing(RecordVersion::getCreatedAt).thenComparingInt(RecordVersion::getVersion))
            .map(HistoryEntryResponse::from)
            .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.VERSION_NOT_FOUND,
                "No version at that date"));
    }

    public WaterfallResponse waterfall(EntityKind kind, UUID recordId) {
        TrackedRecord record = registry.requireRecord(kind, recordId);
        List<RecordVersion> versions = versionStore.versionsWithBackfill(record);
        List<? extends AbstractStep> steps = registry.findSteps(kind, recordId);

        List<WaterfallResponse.ActualPoint> actual = new ArrayList<>();
        String updateSource = kind.name().toLowerCase() + "_update";
        for (int i = 0; i < versions.size(); i++) {
            RecordVersion version = versions.get(i);
            ScorePair scores = kind.scoresOf(version.getSnapshot());
            LevelAssessment assessment = kind.classify(scores);
            actual.add(WaterfallResponse.ActualPoint.builder()
                .date(version.getCreatedAt())
                .source(updateSource)
                .version(version.getVersion())
                .scores(kind.scoreValues(scores))
                .level(assessment.level())
                .rank(assessment.rank())
                .original(i == 0)
                .build());
        }

        List<WaterfallResponse.PlannedPoint> planned = new ArrayList<>();
        for (AbstractStep step : steps) {
            LocalDate plannedDate = step.getEstimatedEndDate() != null
                ? step.getEstimatedEndDate()
                : step.getEstimatedStartDate();
            if (plannedDate != null) {
                ScorePair expected = step.getExpectedScores();
                LevelAssessment assessment = kind.classify(expected);
                planned.add(WaterfallResponse.PlannedPoint.builder()
                    .stepId(step.getId())
                    .stepNumber(step.getStepNumber())
                    .action(step.getActionSummary())
                    .date(plannedDate)
                    .scores(kind.scoreValues(expected))
                    .level(assessment.level())
                    .rank(assessment.rank())
                    .build());
            }

            ScorePair achieved = achievedScores(kind, step);
            if (achieved != null) {
                LevelAssessment assessment = kind.classify(achieved);
                actual.add(WaterfallResponse.ActualPoint.builder()
                    .date(step.getActualCompletedAt())
                    .source("step")
                    .stepId(step.getId())
                    .stepNumber(step.getStepNumber())
                    .scores(kind.scoreValues(achieved))
                    .level(assessment.level())
                    .rank(assessment.rank())
                    .build());
            }
        }

        planned.sort(Comparator.comparing(WaterfallResponse.PlannedPoint::getDate));
        actual.sort(Comparator.comparing(WaterfallResponse.ActualPoint::getDate));

        log.debug("Waterfall for {} {}: {} planned, {} actual points",
            kind.getDisplayName(), recordId, planned.size(), actual.size());
        return WaterfallResponse.builder().planned(planned).actual(actual).build();
    }

    /**
     * Scores a completed step reached, or null when the step has no place in the actual series.
     * Only resolution steps fall back to their expected consequence.
     */
    private static ScorePair achievedScores(EntityKind kind, AbstractStep step) {
        if (step.getActualCompletedAt() == null) {
            return null;
        }
        if (step.getActualScores() != null) {
            return step.getActualScores();
        }
        return kind == EntityKind.ISSUE ? step.getExpectedScores() : null;
    }

    /**
     * Every version of every record in the unit, ascending by date.
     */
    public List<UnitWaterfallPoint> unitWaterfall(EntityKind kind, UUID organizationalUnitId) {
        List<UnitWaterfallPoint> points = new ArrayList<>();
        for (TrackedRecord record : registry.findInUnit(kind, organizationalUnitId)) {
            for (RecordVersion version : versionStore.versionsWithBackfill(record)) {
                ScorePair scores = kind.scoresOf(version.getSnapshot());
                LevelAssessment assessment = kind.classify(scores);
                points.add(UnitWaterfallPoint.builder()
                    .recordId(record.getId())
                    .name(record.getName())
                    .version(version.getVersion())
                    .date(version.getCreatedAt())
                    .scores(kind.scoreValues(scores))
                    .level(assessment.level())
                    .rank(assessment.rank())
                    .build());
            }
        }
        points.sort(Comparator.comparing(UnitWaterfallPoint::getDate));
        return points;
    }
}
