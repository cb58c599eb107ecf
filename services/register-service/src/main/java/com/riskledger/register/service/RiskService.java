package com.riskledger.register.service;

import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.MitigationStep;
import com.riskledger.register.domain.Risk;
import com.riskledger.register.domain.RiskStatus;
import com.riskledger.register.dto.CreateRiskRequest;
import com.riskledger.register.dto.MitigationStepRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateMitigationStepRequest;
import com.riskledger.register.dto.UpdateRiskRequest;
import com.riskledger.register.level.ScorePair;
import com.riskledger.register.repository.MitigationStepRepository;
import com.riskledger.register.repository.RiskRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class RiskService extends AbstractRegisterService<Risk, MitigationStep> {

    private final RiskRepository riskRepository;

    public RiskService(RegisterSupport support, RiskRepository riskRepository,
                       MitigationStepRepository mitigationStepRepository) {
        super(support, riskRepository, mitigationStepRepository);
        this.riskRepository = riskRepository;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.RISK;
    }

    @Override
    protected List<Risk> findInUnit(UUID organizationalUnitId) {
        return riskRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId);
    }

    @Transactional
    public RecordResponse create(CreateRiskRequest request) {
        Risk risk = Risk.builder()
            .organizationalUnitId(request.getOrganizationalUnitId())
            .riskName(requiredText("riskName", request.getRiskName()))
            .riskCondition(requiredText("riskCondition", request.getRiskCondition()))
            .riskIf(requiredText("riskIf", request.getRiskIf()))
            .riskThen(requiredText("riskThen", request.getRiskThen()))
            .category(support.getCategoryService().resolve(CategoryScheme.RISK, request.getCategory()))
            .likelihood(ScorePair.clampOrDefault(request.getLikelihood()))
            .consequence(ScorePair.clampOrDefault(request.getConsequence()))
            .mitigationStrategy(request.getMitigationStrategy())
            .mitigationPlan(optionalText(request.getMitigationPlan()))
            .owner(optionalText(request.getOwner()))
            .status(request.getStatus() != null ? request.getStatus() : RiskStatus.OPEN)
            .build();
        return persistCreated(risk);
    }

    @Transactional
    public RecordResponse update(UUID id, UpdateRiskRequest request) {
        return applyUpdate(id,
            risk -> new ScorePair(scoreOr(request.getLikelihood(), risk.getLikelihood()),
                scoreOr(request.getConsequence(), risk.getConsequence())),
            risk -> request.getStatus() != null ? request.getStatus() : risk.getStatus(),
            request.changeReasons(),
            risk -> {
                if (request.getRiskName() != null) {
                    risk.setRiskName(requiredText("riskName", request.getRiskName()));
                }
                if (request.getRiskCondition() != null) {
                    risk.setRiskCondition(requiredText("riskCondition", request.getRiskCondition()));
                }
                if (request.getRiskIf() != null) {
                    risk.setRiskIf(requiredText("riskIf", request.getRiskIf()));
                }
                if (request.getRiskThen() != null) {
                    risk.setRiskThen(requiredText("riskThen", request.getRiskThen()));
                }
                if (request.isPresent("category")) {
                    risk.setCategory(support.getCategoryService()
                        .resolveForUpdate(CategoryScheme.RISK, request.getCategory(), risk.getCategory()));
                }
                risk.setLikelihood(scoreOr(request.getLikelihood(), risk.getLikelihood()));
                risk.setConsequence(scoreOr(request.getConsequence(), risk.getConsequence()));
                if (request.isPresent("mitigationStrategy")) {
                    risk.setMitigationStrategy(request.getMitigationStrategy());
                }
                if (request.isPresent("mitigationPlan")) {
                    risk.setMitigationPlan(optionalText(request.getMitigationPlan()));
                }
                if (request.isPresent("owner")) {
                    risk.setOwner(optionalText(request.getOwner()));
                }
                if (request.getStatus() != null) {
                    risk.setStatus(request.getStatus());
                }
            });
    }

    @Transactional
    public StepResponse addStep(UUID riskId, MitigationStepRequest request) {
        MitigationStep step = MitigationStep.builder()
            .mitigationActions(requiredText("mitigationActions", request.getMitigationActions()))
            .closureCriteria(requiredText("closureCriteria", request.getClosureCriteria()))
            .estimatedStartDate(request.getEstimatedStartDate())
            .estimatedEndDate(request.getEstimatedEndDate())
            .expectedLikelihood(ScorePair.clampOrDefault(request.getExpectedLikelihood()))
            .expectedConsequence(ScorePair.clampOrDefault(request.getExpectedConsequence()))
            .actualLikelihood(clampOrNull(request.getActualLikelihood()))
            .actualConsequence(clampOrNull(request.getActualConsequence()))
            .actualCompletedAt(request.getActualCompletedAt())
            .build();
        return persistStep(riskId, step, request.getSequenceOrder());
    }

    @Transactional
    public StepResponse updateStep(UUID riskId, UUID stepId, UpdateMitigationStepRequest request) {
        return applyStepUpdate(riskId, stepId, step -> {
            if (request.getMitigationActions() != null) {
                step.setMitigationActions(requiredText("mitigationActions", request.getMitigationActions()));
            }
            if (request.getClosureCriteria() != null) {
                step.setClosureCriteria(requiredText("closureCriteria", request.getClosureCriteria()));
            }
            StepUpdates.applyDates(step, request);
            step.setExpectedLikelihood(scoreOr(request.getExpectedLikelihood(), step.getExpectedLikelihood()));
            step.setExpectedConsequence(scoreOr(request.getExpectedConsequence(), step.getExpectedConsequence()));
            if (request.isPresent("actualLikelihood")) {
                step.setActualLikelihood(clampOrNull(request.getActualLikelihood()));
            }
            if (request.isPresent("actualConsequence")) {
                step.setActualConsequence(clampOrNull(request.getActualConsequence()));
            }
        });
    }
}
