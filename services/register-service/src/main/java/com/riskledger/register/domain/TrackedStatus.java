package com.riskledger.register.domain;

/**
 * Lifecycle status of a tracked record.
 */
public interface TrackedStatus {

    String getCode();

    /**
     * Whether moving into this status requires a {@code statusChangeRationale}.
     */
    boolean isRationaleRequired();
}
