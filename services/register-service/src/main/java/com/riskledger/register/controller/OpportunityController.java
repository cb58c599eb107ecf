package com.riskledger.register.controller;

import com.riskledger.common.api.ApiResponse;
import com.riskledger.register.dto.CreateOpportunityRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.ReorderStepsRequest;
import com.riskledger.register.dto.ActionPlanStepRequest;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateActionPlanStepRequest;
import com.riskledger.register.dto.UpdateOpportunityRequest;
import com.riskledger.register.service.OpportunityService;
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
@RequestMapping("/api/v1/opportunities")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Opportunity Register", description = "Opportunities and their action plan steps")
@Validated
public class OpportunityController {

    private final OpportunityService opportunityService;

    @GetMapping
    @Operation(summary = "List the opportunity register of an organizational unit")
    public ResponseEntity<ApiResponse<List<RecordResponse>>> list(@RequestParam UUID organizationalUnitId) {
        return ResponseEntity.ok(ApiResponse.success(opportunityService.list(organizationalUnitId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get opportunity with its steps")
    public ResponseEntity<ApiResponse<RecordResponse>> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(opportunityService.get(id)));
    }

    @PostMapping
    @Operation(summary = "Create opportunity")
    public ResponseEntity<ApiResponse<RecordResponse>> create(@Valid @RequestBody CreateOpportunityRequest request) {
        log.info("Creating opportunity in unit {}", request.getOrganizationalUnitId());
        RecordResponse response = opportunityService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update opportunity", description = "Score changes and gated status changes require a reason")
    public ResponseEntity<ApiResponse<RecordResponse>> update(@PathVariable UUID id,
                                                              @RequestBody UpdateOpportunityRequest request) {
        log.info("Updating opportunity {}", id);
        return ResponseEntity.ok(ApiResponse.success(opportunityService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete opportunity")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        log.info("Deleting opportunity {}", id);
        opportunityService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Opportunity deleted"));
    }

    @GetMapping("/{id}/steps")
    @Operation(summary = "List action plan steps in order")
    public ResponseEntity<ApiResponse<List<StepResponse>>> listSteps(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(opportunityService.listSteps(id)));
    }

    @PostMapping("/{id}/steps")
    @Operation(summary = "Add action plan step")
    public ResponseEntity<ApiResponse<StepResponse>> addStep(@PathVariable UUID id,
                                                             @Valid @RequestBody ActionPlanStepRequest request) {
        log.info("Adding action plan step to opportunity {}", id);
        StepResponse response = opportunityService.addStep(id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Update action plan step")
    public ResponseEntity<ApiResponse<StepResponse>> updateStep(@PathVariable UUID id, @PathVariable UUID stepId,
                                                                @RequestBody UpdateActionPlanStepRequest request) {
        log.info("Updating action plan step {} of opportunity {}", stepId, id);
        return ResponseEntity.ok(ApiResponse.success(opportunityService.updateStep(id, stepId, request)));
    }

    @DeleteMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Delete action plan step")
    public ResponseEntity<ApiResponse<Void>> deleteStep(@PathVariable UUID id, @PathVariable UUID stepId) {
        log.info("Deleting action plan step {} of opportunity {}", stepId, id);
        opportunityService.deleteStep(id, stepId);
        return ResponseEntity.ok(ApiResponse.success(null, "Step deleted"));
    }

    @PutMapping("/{id}/steps/reorder")
    @Operation(summary = "Reorder action plan steps")
    public ResponseEntity<ApiResponse<List<StepResponse>>> reorderSteps(@PathVariable UUID id,
                                                                        @Valid @RequestBody ReorderStepsRequest request) {
        log.info("Reordering {} action plan steps of opportunity {}", request.getStepIds().size(), id);
        return ResponseEntity.ok(ApiResponse.success(opportunityService.reorderSteps(id, request.getStepIds())));
    }
}
