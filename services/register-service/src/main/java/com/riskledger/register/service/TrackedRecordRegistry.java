package com.riskledger.register.service;

import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.register.domain.AbstractStep;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.TrackedRecord;
import com.riskledger.register.repository.ActionPlanStepRepository;
import com.riskledger.register.repository.IssueRepository;
import com.riskledger.register.repository.MitigationStepRepository;
import com.riskledger.register.repository.OpportunityRepository;
import com.riskledger.register.repository.ResolutionStepRepository;
import com.riskledger.register.repository.RiskRepository;
import com.riskledger.register.repository.StepRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Kind-independent access to records and their steps.
 */
@Component
@RequiredArgsConstructor
public class TrackedRecordRegistry {

    private final RiskRepository riskRepository;
    private final IssueRepository issueRepository;
    private final OpportunityRepository opportunityRepository;
    private final MitigationStepRepository mitigationStepRepository;
    private final ResolutionStepRepository resolutionStepRepository;
    private final ActionPlanStepRepository actionPlanStepRepository;

    public Optional<TrackedRecord> findRecord(EntityKind kind, UUID id) {
        return switch (kind) {
            case RISK -> riskRepository.findById(id).map(TrackedRecord.class::cast);
            case ISSUE -> issueRepository.findById(id).map(TrackedRecord.class::cast);
            case OPPORTUNITY -> opportunityRepository.findById(id).map(TrackedRecord.class::cast);
        };
    }

    public TrackedRecord requireRecord(EntityKind kind, UUID id) {
        return findRecord(kind, id).orElseThrow(() -> new ResourceNotFoundException(kind.getDisplayName(), id));
    }

    public List<TrackedRecord> findInUnit(EntityKind kind, UUID organizationalUnitId) {
        return switch (kind) {
            case RISK -> new ArrayList<>(riskRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId));
            case ISSUE -> new ArrayList<>(issueRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId));
            case OPPORTUNITY -> new ArrayList<>(opportunityRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId));
        };
    }

    public List<? extends AbstractStep> findSteps(EntityKind kind, UUID recordId) {
        return stepRepository(kind).findByRecordIdOrderBySequenceOrderAsc(recordId);
    }

    public StepRepository<? extends AbstractStep> stepRepository(EntityKind kind) {
        return switch (kind) {
            case RISK -> mitigationStepRepository;
            case ISSUE -> resolutionStepRepository;
            case OPPORTUNITY -> actionPlanStepRepository;
        };
    }
}
