package com.riskledger.register.dto;

import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Fields every step update accepts. Dates and completion are cleared only by an explicit null.
 */
@Getter
public abstract class StepUpdateRequest extends PatchRequest {

    private LocalDate estimatedStartDate;
    private LocalDate estimatedEndDate;
    private Instant actualCompletedAt;

    public void setEstimatedStartDate(LocalDate estimatedStartDate) {
        this.estimatedStartDate = estimatedStartDate;
        markPresent("estimatedStartDate");
    }

    public void setEstimatedEndDate(LocalDate estimatedEndDate) {
        this.estimatedEndDate = estimatedEndDate;
        markPresent("estimatedEndDate");
    }

    public void setActualCompletedAt(Instant actualCompletedAt) {
        this.actualCompletedAt = actualCompletedAt;
        markPresent("actualCompletedAt");
    }
}
