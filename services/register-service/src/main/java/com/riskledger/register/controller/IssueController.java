package com.riskledger.register.controller;

import com.riskledger.common.api.ApiResponse;
import com.riskledger.register.dto.CreateIssueRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.ReorderStepsRequest;
import com.riskledger.register.dto.ResolutionStepRequest;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateResolutionStepRequest;
import com.riskledger.register.dto.UpdateIssueRequest;
import com.riskledger.register.service.IssueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/issues")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Issue Register", description = "Issues and their resolution steps")
@Validated
public class IssueController {

    private final IssueService issueService;

    @GetMapping
    @Operation(summary = "List the issue register of an organizational unit")
    public ResponseEntity<ApiResponse<List<RecordResponse>>> list(@RequestParam UUID organizationalUnitId) {
        return ResponseEntity.ok(ApiResponse.success(issueService.list(organizationalUnitId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get issue with its steps")
    public ResponseEntity<ApiResponse<RecordResponse>> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(issueService.get(id)));
    }

    @PostMapping
    @Operation(summary = "Create issue", description = "With sourceRiskId the issue is raised from a realized risk")
    public ResponseEntity<ApiResponse<RecordResponse>> create(@Valid @RequestBody CreateIssueRequest request) {
        log.info("Creating issue in unit {} from risk {}", request.getOrganizationalUnitId(), request.getSourceRiskId());
        RecordResponse response = issueService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update issue", description = "Score changes and gated status changes require a reason")
    public ResponseEntity<ApiResponse<RecordResponse>> update(@PathVariable UUID id,
                                                              @RequestBody UpdateIssueRequest request) {
        log.info("Updating issue {}", id);
        return ResponseEntity.ok(ApiResponse.success(issueService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete issue")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        log.info("Deleting issue {}", id);
        issueService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Issue deleted"));
    }

    @GetMapping("/{id}/steps")
    @Operation(summary = "List resolution steps in order")
    public ResponseEntity<ApiResponse<List<StepResponse>>> listSteps(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(issueService.listSteps(id)));
    }

    @PostMapping("/{id}/steps")
    @Operation(summary = "Add resolution step")
    public ResponseEntity<ApiResponse<StepResponse>> addStep(@PathVariable UUID id,
                                                             @Valid @RequestBody ResolutionStepRequest request) {
        log.info("Adding resolution step to issue {}", id);
        StepResponse response = issueService.addStep(id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Update resolution step")
    public ResponseEntity<ApiResponse<StepResponse>> updateStep(@PathVariable UUID id, @PathVariable UUID stepId,
                                                                @RequestBody UpdateResolutionStepRequest request) {
        log.info("Updating resolution step {} of issue {}", stepId, id);
        return ResponseEntity.ok(ApiResponse.success(issueService.updateStep(id, stepId, request)));
    }

    @DeleteMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Delete resolution step")
    public ResponseEntity<ApiResponse<Void>> deleteStep(@PathVariable UUID id, @PathVariable UUID stepId) {
        log.info("Deleting resolution step {} of issue {}", stepId, id);
        issueService.deleteStep(id, stepId);
        return ResponseEntity.ok(ApiResponse.success(null, "Step deleted"));
    }

    @PutMapping("/{id}/steps/reorder")
    @Operation(summary = "Reorder resolution steps")
    public ResponseEntity<ApiResponse<List<StepResponse>>> reorderSteps(@PathVariable UUID id,
                                                                        @Valid @RequestBody ReorderStepsRequest request) {
        log.info("Reordering {} resolution steps of issue {}", request.getStepIds().size(), id);
        return ResponseEntity.ok(ApiResponse.success(issueService.reorderSteps(id, request.getStepIds())));
    }
}
