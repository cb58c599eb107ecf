package com.riskledger.register.controller;

import com.riskledger.common.api.ApiResponse;
import com.riskledger.register.dto.CreateRiskRequest;
import com.riskledger.register.dto.RecordResponse;
import com.riskledger.register.dto.ReorderStepsRequest;
import com.riskledger.register.dto.MitigationStepRequest;
import com.riskledger.register.dto.StepResponse;
import com.riskledger.register.dto.UpdateMitigationStepRequest;
import com.riskledger.register.dto.UpdateRiskRequest;
import com.riskledger.register.service.RiskService;
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
@RequestMapping("/api/v1/risks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Risk Register", description = "Risks and their mitigation steps")
@Validated
public class RiskController {

    private final RiskService riskService;

    @GetMapping
    @Operation(summary = "List the risk register of an organizational unit")
    public ResponseEntity<ApiResponse<List<RecordResponse>>> list(@RequestParam UUID organizationalUnitId) {
        return ResponseEntity.ok(ApiResponse.success(riskService.list(organizationalUnitId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get risk with its steps")
    public ResponseEntity<ApiResponse<RecordResponse>> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(riskService.get(id)));
    }

    @PostMapping
    @Operation(summary = "Create risk")
    public ResponseEntity<ApiResponse<RecordResponse>> create(@Valid @RequestBody CreateRiskRequest request) {
        log.info("Creating risk in unit {}", request.getOrganizationalUnitId());
        RecordResponse response = riskService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update risk", description = "Score changes and gated status changes require a reason")
    public ResponseEntity<ApiResponse<RecordResponse>> update(@PathVariable UUID id,
                                                              @RequestBody UpdateRiskRequest request) {
        log.info("Updating risk {}", id);
        return ResponseEntity.ok(ApiResponse.success(riskService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete risk")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        log.info("Deleting risk {}", id);
        riskService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Risk deleted"));
    }

    @GetMapping("/{id}/steps")
    @Operation(summary = "List mitigation steps in order")
    public ResponseEntity<ApiResponse<List<StepResponse>>> listSteps(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(riskService.listSteps(id)));
    }

    @PostMapping("/{id}/steps")
    @Operation(summary = "Add mitigation step")
    public ResponseEntity<ApiResponse<StepResponse>> addStep(@PathVariable UUID id,
                                                             @Valid @RequestBody MitigationStepRequest request) {
        log.info("Adding mitigation step to risk {}", id);
        StepResponse response = riskService.addStep(id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @PatchMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Update mitigation step")
    public ResponseEntity<ApiResponse<StepResponse>> updateStep(@PathVariable UUID id, @PathVariable UUID stepId,
                                                                @RequestBody UpdateMitigationStepRequest request) {
        log.info("Updating mitigation step {} of risk {}", stepId, id);
        return ResponseEntity.ok(ApiResponse.success(riskService.updateStep(id, stepId, request)));
    }

    @DeleteMapping("/{id}/steps/{stepId}")
    @Operation(summary = "Delete mitigation step")
    public ResponseEntity<ApiResponse<Void>> deleteStep(@PathVariable UUID id, @PathVariable UUID stepId) {
        log.info("Deleting mitigation step {} of risk {}", stepId, id);
        riskService.deleteStep(id, stepId);
        return ResponseEntity.ok(ApiResponse.success(null, "Step deleted"));
    }

    @PutMapping("/{id}/steps/reorder")
    @Operation(summary = "Reorder mitigation steps")
    public ResponseEntity<ApiResponse<List<StepResponse>>> reorderSteps(@PathVariable UUID id,
                                                                        @Valid @RequestBody ReorderStepsRequest request) {
        log.info("Reordering {} mitigation steps of risk {}", request.getStepIds().size(), id);
        return ResponseEntity.ok(ApiResponse.success(riskService.reorderSteps(id, request.getStepIds())));
    }
}
