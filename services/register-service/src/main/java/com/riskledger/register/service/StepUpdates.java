package com.riskledger.register.service;

import com.riskledger.register.domain.AbstractStep;
import com.riskledger.register.dto.StepUpdateRequest;

/**
 * Applies the fields every step update shares.
 */
final class StepUpdates {

    private StepUpdates() {
    }

    static void applyDates(AbstractStep step, StepUpdateRequest request) {
        if (request.isPresent("estimatedStartDate")) {
            step.setEstimatedStartDate(request.getEstimatedStartDate());
        }
        if (request.isPresent("estimatedEndDate")) {
            step.setEstimatedEndDate(request.getEstimatedEndDate());
        }
        if (request.isPresent("actualCompletedAt")) {
            step.setActualCompletedAt(request.getActualCompletedAt());
        }
    }
}
