package com.riskledger.register.service;

import com.riskledger.common.error.BusinessException;
import com.riskledger.common.error.ErrorCode;
import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.common.error.ValidationException;
import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.Issue;
import com.riskledger.register.domain.IssueStatus;
import com.riskledger.register.domain.ResolutionStep;
import com.riskledger.register.domain.Risk;
import com.riskledger.register.domain.RiskStatus;
import com.riskledger.register.dto.CreateIssueRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.ResolutionStepRequest;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateIssueRequest;
import com.riskledger.register.dto.UpdateResolutionStepRequest;
import com.riskledger.register.level.ScorePair;
import com.riskledger.register.repository.IssueRepository;
import com.riskledger.register.repository.ResolutionStepRepository;
import com.riskledger.register.repository.RiskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Issue register. Issues are classified on consequence alone and carry no status gate.
 */
@Slf4j
@Service
public class IssueService extends AbstractRegisterService<Issue, ResolutionStep> {

    private final IssueRepository issueRepository;
    private final RiskRepository riskRepository;

    public IssueService(RegisterSupport support, IssueRepository issueRepository,
                        ResolutionStepRepository resolutionStepRepository, RiskRepository riskRepository) {
        super(support, issueRepository, resolutionStepRepository);
        this.issueRepository = issueRepository;
        this.riskRepository = riskRepository;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ISSUE;
    }

    @Override
    protected List<Issue> findInUnit(UUID organizationalUnitId) {
        return issueRepository.findByOrganizationalUnitIdOrderByUpdatedAtDesc(organizationalUnitId);
    }

    /**
     * Creates an issue. With a source risk, omitted fields are filled from that risk, which must
     * be realized.
     */
    @Transactional
    public RecordResponse create(CreateIssueRequest request) {
        Risk source = request.getSourceRiskId() != null ? requireRealizedRisk(request.getSourceRiskId()) : null;

        UUID unitId = request.getOrganizationalUnitId() != null
            ? request.getOrganizationalUnitId()
            : source != null ? source.getOrganizationalUnitId() : null;
        if (unitId == null) {
            throw ValidationException.requiredField("organizationalUnitId");
        }

        Issue issue = Issue.builder()
            .organizationalUnitId(unitId)
            .issueName(requiredText("issueName",
                firstText(request.getIssueName(), source != null ? source.getRiskName() : null)))
            .description(optionalText(firstText(request.getDescription(), source != null ? statementOf(source) : null)))
            .consequence(request.getConsequence() != null || source == null
                ? ScorePair.clampOrDefault(request.getConsequence())
                : source.getConsequence())
            .category(support.getCategoryService().resolve(CategoryScheme.RISK,
                firstText(request.getCategory(), source != null ? source.getCategory() : null)))
            .owner(optionalText(firstText(request.getOwner(), source != null ? source.getOwner() : null)))
            .status(request.getStatus() != null ? request.getStatus() : IssueStatus.CONTROL)
            .sourceRiskId(source != null ? source.getId() : null)
            .build();

        if (source != null) {
            log.info("Raising issue from realized risk {}", source.getId());
        }
        return persistCreated(issue);
    }

    @Transactional
    public RecordResponse update(UUID id, UpdateIssueRequest request) {
        return applyUpdate(id,
            issue -> new ScorePair(1, scoreOr(request.getConsequence(), issue.getConsequence())),
            issue -> request.getStatus() != null ? request.getStatus() : issue.getStatus(),
            request.changeReasons(),
            issue -> {
                if (request.getIssueName() != null) {
                    issue.setIssueName(requiredText("issueName", request.getIssueName()));
                }
                if (request.isPresent("description")) {
                    issue.setDescription(optionalText(request.getDescription()));
                }
                issue.setConsequence(scoreOr(request.getConsequence(), issue.getConsequence()));
                if (request.isPresent("owner")) {
                    issue.setOwner(optionalText(request.getOwner()));
                }
                if (request.isPresent("category")) {
                    issue.setCategory(support.getCategoryService()
                        .resolveForUpdate(CategoryScheme.RISK, request.getCategory(), issue.getCategory()));
                }
                if (request.getStatus() != null) {
                    issue.setStatus(request.getStatus());
                }
            });
    }

    @Transactional
    public StepResponse addStep(UUID issueId, ResolutionStepRequest request) {
        Issue issue = require(issueId);
        String action = optionalText(request.getPlannedAction());
        ResolutionStep step = ResolutionStep.builder()
            .plannedAction(action != null ? action : ResolutionStep.DEFAULT_ACTION)
            .estimatedStartDate(request.getEstimatedStartDate())
            .estimatedEndDate(request.getEstimatedEndDate())
            .expectedConsequence(request.getExpectedConsequence() != null
                ? ScorePair.clamp(request.getExpectedConsequence())
                : issue.getConsequence())
            .actualConsequence(clampOrNull(request.getActualConsequence()))
            .actualCompletedAt(request.getActualCompletedAt())
            .build();
        return persistStep(issueId, step, request.getSequenceOrder());
    }

    @Transactional
    public StepResponse updateStep(UUID issueId, UUID stepId, UpdateResolutionStepRequest request) {
        return applyStepUpdate(issueId, stepId, step -> {
            if (request.getPlannedAction() != null) {
                step.setPlannedAction(requiredText("plannedAction", request.getPlannedAction()));
            }
            StepUpdates.applyDates(step, request);
            step.setExpectedConsequence(scoreOr(request.getExpectedConsequence(), step.getExpectedConsequence()));
            if (request.isPresent("actualConsequence")) {
                step.setActualConsequence(clampOrNull(request.getActualConsequence()));
            }
        });
    }

    private Risk requireRealizedRisk(UUID riskId) {
        Risk risk = riskRepository.findById(riskId)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.RISK.getDisplayName(), riskId));
        if (risk.getStatus() != RiskStatus.REALIZED) {
            throw new BusinessException(ErrorCode.INVALID_STATE_TRANSITION,
                "Only a realized risk can raise an issue; risk " + riskId + " is " + risk.getStatus().getCode());
        }
        return risk;
    }

    private static String statementOf(Risk risk) {
        return "Condition: " + risk.getRiskCondition() + " | If: " + risk.getRiskIf() + " | Then: " + risk.getRiskThen();
    }

    private static String firstText(String requested, String fallback) {
        return requested != null && !requested.isBlank() ? requested : fallback;
    }
}
