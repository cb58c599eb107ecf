package com.riskledger.register.domain;

import com.riskledger.register.level.Level;
import com.riskledger.register.level.ScorePair;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A risk, issue or opportunity whose changes are versioned and audited.
 */
public interface TrackedRecord {

    UUID getId();

    EntityKind getKind();

    UUID getOrganizationalUnitId();

    String getName();

    TrackedStatus getStatus();

    ScorePair getScores();

    Level getLevel();

    Integer getLevelRank();

    String getCategory();

    String getOwner();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    /**
     * Ordered copy of every versioned field, keyed by its request name. Values are
     * scalars, codes or {@code java.time} values.
     */
    Map<String, Object> toSnapshot();
}
