package com.riskledger.register.service;

import com.riskledger.common.error.BusinessException;
import com.riskledger.common.error.ErrorCode;
import com.riskledger.common.error.ResourceNotFoundException;
import com.riskledger.common.error.ValidationException;
import com.riskledger.register.domain.AuditAction;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.OpportunityStatus;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.RiskStatus;
import com.riskledger.register.domain.audit.FieldChange;
import com.riskledger.register.domain.audit.UpdatedDetails;
import com.riskledger.register.dto.AuditLogEntryResponse;
import com.riskledger.register.dto.CreateIssueRequest;
import com.riskledger.register.dto.CreateOpportunityRequest;
import com.riskledger.register.dto.CreateRiskRequest;
import com.riskledger.register.dto.HistoryEntryResponse;
import com.riskledger.register.dto.MitigationStepRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateMitigationStepRequest;
import com.riskledger.register.dto.UpdateOpportunityRequest;
import com.riskledger.register.dto.UpdateRiskRequest;
import com.riskledger.register.level.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end register flows against the in-memory database.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Register flow integration tests")
class RegisterFlowIntegrationTest {

    @Autowired
    private RiskService riskService;

    @Autowired
    private IssueService issueService;

    @Autowired
    private OpportunityService opportunityService;

    @Autowired
    private VersionStore versionStore;

    @Autowired
    private TemporalReconstructionService reconstructionService;

    private UUID unitId;

    @BeforeEach
    void setUp() {
        unitId = UUID.randomUUID();
    }

    @Nested
    @DisplayName("Risk")
    class RiskFlows {

        @Test
        @DisplayName("create L3xC3, then raise likelihood to 5 with a reason")
        void createAndRescore() {
            RecordResponse created = riskService.create(riskRequest(3, 3));
            UUID id = created.getId();

            assertThat(created.getFields()).containsEntry("riskLevel", "moderate");
            assertThat(created.getLevelRank()).isEqualTo(14);
            List<RecordVersion> initial = versionStore.listVersions(id);
            assertThat(initial).singleElement().satisfies(version -> {
                assertThat(version.getVersion()).isEqualTo(1);
                assertThat(version.getSnapshot())
                    .containsEntry("riskName", "Supplier delay")
                    .containsEntry("likelihood", 3)
                    .containsEntry("consequence", 3);
            });
            assertThat(riskService.auditLog(id)).singleElement()
                .satisfies(entry -> assertThat(entry.getAction()).isEqualTo(AuditAction.CREATED));

            UpdateRiskRequest update = new UpdateRiskRequest();
            update.setLikelihood(5);
            update.setLikelihoodChangeReason("reassessed exposure");
            RecordResponse updated = riskService.update(id, update);

            assertThat(updated.getFields()).containsEntry("riskLevel", "high").containsEntry("likelihood", 5);
            assertThat(updated.getLevelRank()).isEqualTo(20);
            assertThat(updated.getFields())
                .containsEntry("originalLikelihood", 3)
                .containsEntry("originalConsequence", 3);

            List<RecordVersion> versions = versionStore.listVersions(id);
            assertThat(versions).extracting(RecordVersion::getVersion).containsExactly(1, 2);
            assertThat(versions.get(1).getCreatedAt()).isAfter(versions.get(0).getCreatedAt());
            assertThat(versions.get(1).getChangeReasons())
                .containsEntry("likelihoodChangeReason", "reassessed exposure");

            AuditLogEntryResponse latest = riskService.auditLog(id).get(0);
            assertThat(latest.getAction()).isEqualTo(AuditAction.UPDATED);
            UpdatedDetails details = (UpdatedDetails) latest.getDetails();
            assertThat(details.getChanges()).containsOnlyKeys("likelihood");
            assertThat(details.getChanges().get("likelihood")).isEqualTo(new FieldChange(3, 5));
            assertThat(details.reasonFields()).containsEntry("likelihoodChangeReason", "reassessed exposure");
        }

        @Test
        @DisplayName("a rejected score change leaves no version or audit entry")
        void rejectedChangeHasNoSideEffects() {
            UUID id = riskService.create(riskRequest(3, 3)).getId();
            UpdateRiskRequest update = new UpdateRiskRequest();
            update.setLikelihood(4);
            update.setRiskName("Renamed in the same request");

            assertThatThrownBy(() -> riskService.update(id, update))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).hasFieldError("likelihoodChangeReason")).isTrue());

            assertThat(versionStore.listVersions(id)).hasSize(1);
            assertThat(riskService.auditLog(id)).hasSize(1);
            assertThat(riskService.get(id).getFields())
                .containsEntry("likelihood", 3)
                .containsEntry("riskName", "Supplier delay");
        }

        @Test
        @DisplayName("a narrative-only change needs no reason and diffs exactly that field")
        void narrativeChange() {
            UUID id = riskService.create(riskRequest(2, 2)).getId();
            UpdateRiskRequest update = new UpdateRiskRequest();
            update.setOwner("Programme office");

            riskService.update(id, update);

            assertThat(versionStore.listVersions(id)).hasSize(2);
            UpdatedDetails details = (UpdatedDetails) riskService.auditLog(id).get(0).getDetails();
            assertThat(details.getChangedFields()).containsExactly("owner");
            assertThat(details.getChanges().get("owner")).isEqualTo(new FieldChange("Risk lead", "Programme office"));
        }

        @Test
        void closingNeedsRationaleWhichTheListingShows() {
            UUID id = riskService.create(riskRequest(2, 2)).getId();
            UpdateRiskRequest close = new UpdateRiskRequest();
            close.setStatus(RiskStatus.CLOSED);

            assertThatThrownBy(() -> riskService.update(id, close)).isInstanceOf(ValidationException.class);

            close.setStatusChangeRationale("Supplier qualified");
            riskService.update(id, close);

            assertThat(riskService.list(unitId)).singleElement()
                .satisfies(row -> assertThat(row.getStatusChangeRationale()).isEqualTo("Supplier qualified"));
        }

        @Test
        void resolvesCategoriesAgainstTheRiskList() {
            CreateRiskRequest known = riskRequest(2, 2);
            known.setCategory("schedule");
            CreateRiskRequest unknown = riskRequest(2, 2);
            unknown.setCategory("weather");

            assertThat(riskService.create(known).getFields()).containsEntry("category", "schedule");
            assertThat(riskService.create(unknown).getFields()).containsEntry("category", null);
        }

        @Test
        @DisplayName("delete keeps versions and records a deleted entry")
        void deleteRetainsHistory() {
            UUID id = riskService.create(riskRequest(2, 2)).getId();

            riskService.delete(id);

            assertThatThrownBy(() -> riskService.get(id)).isInstanceOf(ResourceNotFoundException.class);
            assertThat(versionStore.listVersions(id)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Steps")
    class StepFlows {

        @Test
        @DisplayName("reorder [s1,s2,s3] -> [s3,s1,s2] records one reorder entry")
        void reorder() {
            UUID id = riskService.create(riskRequest(4, 4)).getId();
            StepResponse s1 = riskService.addStep(id, stepRequest("Qualify second supplier"));
            StepResponse s2 = riskService.addStep(id, stepRequest("Build buffer stock"));
            StepResponse s3 = riskService.addStep(id, stepRequest("Renegotiate contract"));

            List<StepResponse> reordered = riskService.reorderSteps(id, List.of(s3.getId(), s1.getId(), s2.getId()));

            assertThat(reordered).extracting(StepResponse::getId).containsExactly(s3.getId(), s1.getId(), s2.getId());
            assertThat(reordered).extracting(StepResponse::getStepNumber).containsExactly(1, 2, 3);

            List<UpdatedDetails> reorders = riskService.auditLog(id).stream()
                .map(AuditLogEntryResponse::getDetails)
                .filter(UpdatedDetails.class::isInstance)
                .map(UpdatedDetails.class::cast)
                .filter(details -> details.getChanges().containsKey("mitigationStepsReordered"))
                .toList();
            assertThat(reorders).singleElement().satisfies(details ->
                assertThat(details.getChanges().get("mitigationStepsReordered"))
                    .isEqualTo(new FieldChange("1, 2, 3", "3, 1, 2")));
        }

        @Test
        void insertingAndDeletingKeepsOrderDense() {
            UUID id = riskService.create(riskRequest(4, 4)).getId();
            StepResponse first = riskService.addStep(id, stepRequest("first"));
            riskService.addStep(id, stepRequest("second"));
            MitigationStepRequest front = stepRequest("front");
            front.setSequenceOrder(0);
            riskService.addStep(id, front);

            riskService.deleteStep(id, first.getId());

            assertThat(riskService.listSteps(id))
                .extracting(step -> step.getFields().get("mitigationActions"))
                .containsExactly("front", "second");
            assertThat(riskService.listSteps(id)).extracting(StepResponse::getStepNumber).containsExactly(1, 2);
        }

        @Test
        @DisplayName("a partial step update keeps the actual scores it does not mention")
        void partialStepUpdateKeepsActuals() {
            UUID id = riskService.create(riskRequest(4, 4)).getId();
            MitigationStepRequest completed = stepRequest("Qualify second supplier");
            completed.setActualLikelihood(1);
            completed.setActualConsequence(1);
            completed.setActualCompletedAt(Instant.parse("2030-05-01T00:00:00Z"));
            StepResponse step = riskService.addStep(id, completed);

            UpdateMitigationStepRequest rename = new UpdateMitigationStepRequest();
            rename.setMitigationActions("Qualify and onboard second supplier");
            StepResponse updated = riskService.updateStep(id, step.getId(), rename);

            assertThat(updated.getFields())
                .containsEntry("mitigationActions", "Qualify and onboard second supplier")
                .containsEntry("actualLikelihood", 1)
                .containsEntry("actualConsequence", 1);
            assertThat(updated.getActualLevel()).isEqualTo(Level.LOW);
            assertThat(updated.getActualRank()).isEqualTo(1);
        }

        @Test
        @DisplayName("an explicit null clears an actual score and its derived level")
        void explicitNullClearsActual() {
            UUID id = riskService.create(riskRequest(4, 4)).getId();
            MitigationStepRequest completed = stepRequest("Qualify second supplier");
            completed.setActualLikelihood(1);
            completed.setActualConsequence(1);
            StepResponse step = riskService.addStep(id, completed);

            UpdateMitigationStepRequest clear = new UpdateMitigationStepRequest();
            clear.setActualLikelihood(null);
            StepResponse updated = riskService.updateStep(id, step.getId(), clear);

            assertThat(updated.getFields())
                .containsEntry("actualLikelihood", null)
                .containsEntry("actualConsequence", 1);
            assertThat(updated.getActualLevel()).isNull();
            assertThat(updated.getActualRank()).isNull();
        }

        @Test
        void stepVersionsAppearInHistory() {
            UUID id = riskService.create(riskRequest(4, 4)).getId();
            riskService.addStep(id, stepRequest("Qualify second supplier"));

            List<HistoryEntryResponse> history = reconstructionService.history(EntityKind.RISK, id);

            assertThat(history).extracting(HistoryEntryResponse::getType)
                .containsExactly(RecordScope.ENTITY, RecordScope.STEP);
            assertThat(history.get(1).getStepNumber()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("history at an instant returns the version current then")
    void historyAtInstant() {
        RecordResponse created = riskService.create(riskRequest(3, 3));
        UpdateRiskRequest update = new UpdateRiskRequest();
        update.setConsequence(5);
        update.setConsequenceChangeReason("contract penalty confirmed");
        riskService.update(created.getId(), update);
        Instant firstVersionAt = versionStore.listVersions(created.getId()).get(0).getCreatedAt();

        HistoryEntryResponse atCreation = reconstructionService.historyAt(EntityKind.RISK, created.getId(),
            firstVersionAt);

        assertThat(atCreation.getVersion()).isEqualTo(1);
        assertThat(atCreation.getSnapshot()).containsEntry("consequence", 3);
        assertThatThrownBy(() -> reconstructionService.historyAt(EntityKind.RISK, created.getId(),
            firstVersionAt.minusSeconds(1)))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Nested
    @DisplayName("Opportunity")
    class OpportunityFlows {

        @Test
        @DisplayName("pursue_now -> defer needs a rationale that lands in version and audit entry")
        void deferNeedsRationale() {
            UUID id = opportunityService.create(CreateOpportunityRequest.builder()
                .organizationalUnitId(unitId)
                .opportunityName("Shared tooling")
                .opportunityCondition("Two teams build the same tooling")
                .opportunityIf("the teams share one toolchain")
                .opportunityThen("maintenance cost drops")
                .likelihood(3)
                .impact(4)
                .build()).getId();

            UpdateOpportunityRequest defer = new UpdateOpportunityRequest();
            defer.setStatus(OpportunityStatus.DEFER);
            assertThatThrownBy(() -> opportunityService.update(id, defer))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("statusChangeRationale");
            assertThat(versionStore.listVersions(id)).hasSize(1);

            defer.setStatusChangeRationale("Budget freeze until Q3");
            RecordResponse deferred = opportunityService.update(id, defer);

            assertThat(deferred.getFields()).containsEntry("status", "defer");
            assertThat(versionStore.listVersions(id).get(1).getChangeReasons())
                .containsEntry("statusChangeRationale", "Budget freeze until Q3");
            UpdatedDetails details = (UpdatedDetails) opportunityService.auditLog(id).get(0).getDetails();
            assertThat(details.reasonFields()).containsEntry("statusChangeRationale", "Budget freeze until Q3");
            assertThat(details.getChanges().get("status")).isEqualTo(new FieldChange("pursue_now", "defer"));
        }
    }

    @Nested
    @DisplayName("Issue")
    class IssueFlows {

        @Test
        void onlyRealizedRiskRaisesIssue() {
            CreateRiskRequest riskRequest = riskRequest(4, 4);
            riskRequest.setCategory("cost");
            UUID riskId = riskService.create(riskRequest).getId();
            CreateIssueRequest fromRisk = CreateIssueRequest.builder().sourceRiskId(riskId).build();

            assertThatThrownBy(() -> issueService.create(fromRisk))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATE_TRANSITION.getCode());

            UpdateRiskRequest realize = new UpdateRiskRequest();
            realize.setStatus(RiskStatus.REALIZED);
            realize.setStatusChangeRationale("Supplier missed delivery");
            riskService.update(riskId, realize);

            RecordResponse issue = issueService.create(fromRisk);

            assertThat(issue.getOrganizationalUnitId()).isEqualTo(unitId);
            assertThat(issue.getFields())
                .containsEntry("issueName", "Supplier delay")
                .containsEntry("consequence", 4)
                .containsEntry("category", "cost")
                .containsEntry("owner", "Risk lead")
                .containsEntry("sourceRiskId", riskId.toString())
                .containsEntry("issueLevel", Level.MODERATE.getCode());
            assertThat(issue.getLevelRank()).isEqualTo(23);
        }
    }

    private CreateRiskRequest riskRequest(int likelihood, int consequence) {
        return CreateRiskRequest.builder()
            .organizationalUnitId(unitId)
            .riskName("Supplier delay")
            .riskCondition("Single qualified supplier")
            .riskIf("the supplier slips")
            .riskThen("integration starts late")
            .likelihood(likelihood)
            .consequence(consequence)
            .owner("Risk lead")
            .build();
    }

    private static MitigationStepRequest stepRequest(String action) {
        return MitigationStepRequest.builder()
            .mitigationActions(action)
            .closureCriteria("Verified by programme office")
            .expectedLikelihood(2)
            .expectedConsequence(3)
            .build();
    }
}
