package com.riskledger.register.controller;

import com.riskledger.common.api.ApiResponse;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.dto.AuditLogEntryResponse;
import com.riskledger.register.dto.BackfillResponse;
import com.riskledger.register.dto.HistoryEntryResponse;
import com.riskledger.register.dto.UnitWaterfallPoint;
import com.riskledger.register.dto.WaterfallResponse;
import com.riskledger.register.service.AbstractRegisterService;
import com.riskledger.register.service.TemporalReconstructionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * History, waterfall and audit trail of any register, addressed by collection name
 * ({@code risks}, {@code issues}, {@code opportunities}).
 */
@RestController
@RequestMapping("/api/v1/{collection}")
@Slf4j
@Tag(name = "Record History", description = "Version history, waterfall series and audit trail")
public class RecordHistoryController {

    private final TemporalReconstructionService reconstructionService;
    private final Map<EntityKind, AbstractRegisterService<?, ?>> registers = new EnumMap<>(EntityKind.class);

    public RecordHistoryController(TemporalReconstructionService reconstructionService,
                                   List<AbstractRegisterService<?, ?>> registerServices) {
        this.reconstructionService = reconstructionService;
        registerServices.forEach(service -> registers.put(service.kind(), service));
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Get version history",
        description = "Without 'at' returns record and step versions merged by time; with 'at' the record version current at that instant")
    public ResponseEntity<ApiResponse<?>> history(
            @PathVariable String collection,
            @PathVariable UUID id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        EntityKind kind = EntityKind.fromCollection(collection);
        if (at != null) {
            HistoryEntryResponse entry = reconstructionService.historyAt(kind, id, at);
            return ResponseEntity.ok(ApiResponse.success(entry));
        }
        List<HistoryEntryResponse> history = reconstructionService.history(kind, id);
        return ResponseEntity.ok(ApiResponse.success(history));
    }

    @GetMapping("/{id}/waterfall")
    @Operation(summary = "Get planned and actual level series")
    public ResponseEntity<ApiResponse<WaterfallResponse>> waterfall(@PathVariable String collection,
                                                                    @PathVariable UUID id) {
        EntityKind kind = EntityKind.fromCollection(collection);
        return ResponseEntity.ok(ApiResponse.success(reconstructionService.waterfall(kind, id)));
    }

    @GetMapping("/{id}/audit-log")
    @Operation(summary = "Get audit trail, newest first")
    public ResponseEntity<ApiResponse<List<AuditLogEntryResponse>>> auditLog(@PathVariable String collection,
                                                                             @PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(register(collection).auditLog(id)));
    }

    @GetMapping("/waterfall/data")
    @Operation(summary = "Get actual level series of every record in a unit")
    public ResponseEntity<ApiResponse<List<UnitWaterfallPoint>>> unitWaterfall(@PathVariable String collection,
                                                                               @RequestParam UUID organizationalUnitId) {
        EntityKind kind = EntityKind.fromCollection(collection);
        return ResponseEntity.ok(ApiResponse.success(reconstructionService.unitWaterfall(kind, organizationalUnitId)));
    }

    @PostMapping("/backfill-versions")
    @Operation(summary = "Create version 1 for records without versions")
    public ResponseEntity<ApiResponse<BackfillResponse>> backfillVersions(@PathVariable String collection) {
        AbstractRegisterService<?, ?> register = register(collection);
        log.info("Backfilling {} versions", register.kind().getDisplayName());
        int backfilled = register.backfillVersions();
        return ResponseEntity.ok(ApiResponse.success(new BackfillResponse(register.kind().getCollection(), backfilled)));
    }

    private AbstractRegisterService<?, ?> register(String collection) {
        return registers.get(EntityKind.fromCollection(collection));
    }
}
