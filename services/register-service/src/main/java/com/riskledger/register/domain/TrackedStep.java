package com.riskledger.register.domain;

import com.riskledger.register.level.ScorePair;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * A planned sub-action of a tracked record.
 */
public interface TrackedStep {

    UUID getId();

    UUID getRecordId();

    EntityKind getKind();

    int getSequenceOrder();

    void setSequenceOrder(int sequenceOrder);

    /**
     * 1-based display position.
     */
    default int getStepNumber() {
        return getSequenceOrder() + 1;
    }

    String getActionSummary();

    LocalDate getEstimatedStartDate();

    LocalDate getEstimatedEndDate();

    Instant getActualCompletedAt();

    Instant getUpdatedAt();

    ScorePair getExpectedScores();

    /**
     * Actual scores, or null until every actual score has been recorded.
     */
    ScorePair getActualScores();

    Map<String, Object> toSnapshot();
}
