package com.riskledger.register.service;

import com.riskledger.register.domain.ActionPlanStep;
import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.Opportunity;
import com.riskledger.register.domain.OpportunityStatus;
import com.riskledger.register.dto.ActionPlanStepRequest;
import com.riskledger.register.dto.CreateOpportunityRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateActionPlanStepRequest;
import com.riskledger.register.dto.UpdateOpportunityRequest;
import com.riskledger.register.level.ScorePair;
import com.riskledger.register.repository.ActionPlanStepRepository;
import com.riskledger.register.repository.OpportunityRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class OpportunityService extends AbstractRegisterService<Opportunity, ActionPlanStep> {

    private final OpportunityRepository opportunityRepository;

    public OpportunityService(RegisterSupport support, OpportunityRepository opportunityRepository,
                              ActionPlanStepRepository actionPlanStepRepository) {
        super(support, opportunityRepository, actionPlanStepRepository);
        this.opportunityRepository = opportunityRepository;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.OPPORTUNITY;
    }

    @Override
    protected List<Opportunity> findInUnit(UUID organizationalUnitId) {
        return opportunityRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId);
    }

    @Transactional
    public RecordResponse create(CreateOpportunityRequest request) {
        Opportunity opportunity = Opportunity.builder()
            .organizationalUnitId(request.getOrganizationalUnitId())
            .opportunityName(requiredText("opportunityName", request.getOpportunityName()))
            .opportunityCondition(requiredText("opportunityCondition", request.getOpportunityCondition()))
            .opportunityIf(requiredText("opportunityIf", request.getOpportunityIf()))
            .opportunityThen(requiredText("opportunityThen", request.getOpportunityThen()))
            .category(support.getCategoryService().resolve(CategoryScheme.OPPORTUNITY, request.getCategory()))
            .likelihood(ScorePair.clampOrDefault(request.getLikelihood()))
            .impact(ScorePair.clampOrDefault(request.getImpact()))
            .owner(optionalText(request.getOwner()))
            .status(request.getStatus() != null ? request.getStatus() : OpportunityStatus.PURSUE_NOW)
            .build();
        return persistCreated(opportunity);
    }

    @Transactional
    public RecordResponse update(UUID id, UpdateOpportunityRequest request) {
        return applyUpdate(id,
            opportunity -> new ScorePair(scoreOr(request.getLikelihood(), opportunity.getLikelihood()),
                scoreOr(request.getImpact(), opportunity.getImpact())),
            opportunity -> request.getStatus() != null ? request.getStatus() : opportunity.getStatus(),
            request.changeReasons(),
            opportunity -> {
                if (request.getOpportunityName() != null) {
                    opportunity.setOpportunityName(requiredText("opportunityName", request.getOpportunityName()));
                }
                if (request.getOpportunityCondition() != null) {
                    opportunity.setOpportunityCondition(
                        requiredText("opportunityCondition", request.getOpportunityCondition()));
                }
                if (request.getOpportunityIf() != null) {
                    opportunity.setOpportunityIf(requiredText("opportunityIf", request.getOpportunityIf()));
                }
                if (request.getOpportunityThen() != null) {
                    opportunity.setOpportunityThen(requiredText("opportunityThen", request.getOpportunityThen()));
                }
                if (request.isPresent("category")) {
                    opportunity.setCategory(support.getCategoryService()
                        .resolveForUpdate(CategoryScheme.OPPORTUNITY, request.getCategory(), opportunity.getCategory()));
                }
                opportunity.setLikelihood(scoreOr(request.getLikelihood(), opportunity.getLikelihood()));
                opportunity.setImpact(scoreOr(request.getImpact(), opportunity.getImpact()));
                if (request.isPresent("owner")) {
                    opportunity.setOwner(optionalText(request.getOwner()));
                }
                if (request.getStatus() != null) {
                    opportunity.setStatus(request.getStatus());
                }
            });
    }

    @Transactional
    public StepResponse addStep(UUID opportunityId, ActionPlanStepRequest request) {
        ActionPlanStep step = ActionPlanStep.builder()
            .plannedAction(requiredText("plannedAction", request.getPlannedAction()))
            .estimatedStartDate(request.getEstimatedStartDate())
            .estimatedEndDate(request.getEstimatedEndDate())
            .expectedLikelihood(ScorePair.clampOrDefault(request.getExpectedLikelihood()))
            .expectedImpact(ScorePair.clampOrDefault(request.getExpectedImpact()))
            .actualLikelihood(clampOrNull(request.getActualLikelihood()))
            .actualImpact(clampOrNull(request.getActualImpact()))
            .actualCompletedAt(request.getActualCompletedAt())
            .build();
        return persistStep(opportunityId, step, request.getSequenceOrder());
    }

    @Transactional
    public StepResponse updateStep(UUID opportunityId, UUID stepId, UpdateActionPlanStepRequest request) {
        return applyStepUpdate(opportunityId, stepId, step -> {
            if (request.getPlannedAction() != null) {
                step.setPlannedAction(requiredText("plannedAction", request.getPlannedAction()));
            }
            StepUpdates.applyDates(step, request);
            step.setExpectedLikelihood(scoreOr(request.getExpectedLikelihood(), step.getExpectedLikelihood()));
            step.setExpectedImpact(scoreOr(request.getExpectedImpact(), step.getExpectedImpact()));
            if (request.isPresent("actualLikelihood")) {
                step.setActualLikelihood(clampOrNull(request.getActualLikelihood()));
            }
            if (request.isPresent("actualImpact")) {
                step.setActualImpact(clampOrNull(request.getActualImpact()));
            }
        });
    }
}
