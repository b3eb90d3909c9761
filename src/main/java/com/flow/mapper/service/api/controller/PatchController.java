package com.flow.mapper.service.api.controller;

import com.flow.mapper.service.api.dto.ApiResponse;
import com.flow.mapper.service.api.dto.FlowDetailResponse;
import com.flow.mapper.service.api.dto.FlowResponses;
import com.flow.mapper.service.api.dto.HistoryEntryResponse;
import com.flow.mapper.service.api.dto.PatchRequest;
import com.flow.mapper.service.api.dto.PatchResponse;
import com.flow.mapper.service.engine.FlowEditingService;
import com.flow.mapper.service.topology.TopologyValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Controller for patch application.
 * Handles apply, dry run, history and single-step rollback.
 */
@Slf4j
@RestController
@Tag(name = "Patches", description = "Endpoints for applying and undoing patches")
@RequiredArgsConstructor
public class PatchController {

    private final FlowEditingService editingService;
    private final TopologyValidator topologyValidator;
    private final Clock flowClock;

    @PostMapping("/flows/{flowId}/patches")
    @Operation(summary = "Apply patch",
               description = "Applies all operations or none; MERGE nodes are inserted where needed")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Patch applied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Flow not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422", description = "Operation rejected")
    })
    public ResponseEntity<ApiResponse<PatchResponse>> applyPatch(
            @Parameter(description = "Flow ID") @PathVariable String flowId,
            @Valid @RequestBody PatchRequest request) {
        log.debug("Applying patch to flow {}: {} operations", flowId, request.getOperations().size());

        var outcome = editingService.applyPatch(flowId, request.toPatch(flowClock.instant()));
        return ResponseEntity.ok(ApiResponse.success(
                FlowResponses.applied(outcome.entry(), outcome.result(), topologyValidator)));
    }

    @PostMapping("/flows/{flowId}/patches/preview")
    @Operation(summary = "Preview patch", description = "Dry run: returns the resulting graph without storing it")
    public ResponseEntity<ApiResponse<PatchResponse>> previewPatch(
            @Parameter(description = "Flow ID") @PathVariable String flowId,
            @Valid @RequestBody PatchRequest request) {
        var result = editingService.previewPatch(flowId, request.toPatch(flowClock.instant()));
        return ResponseEntity.ok(ApiResponse.success(FlowResponses.preview(flowId, result)));
    }

    @PostMapping("/flows/{flowId}/rollback")
    @Operation(summary = "Roll back", description = "Restores the snapshot taken before the most recent patch")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Rolled back"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Nothing to roll back")
    })
    public ResponseEntity<ApiResponse<FlowDetailResponse>> rollback(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        var entry = editingService.rollback(flowId);
        return ResponseEntity.ok(ApiResponse.success(FlowResponses.detail(entry, topologyValidator)));
    }

    @GetMapping("/flows/{flowId}/history")
    @Operation(summary = "Patch history", description = "Undoable patches, oldest first")
    public ResponseEntity<ApiResponse<List<HistoryEntryResponse>>> getHistory(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        var entries = editingService.history(flowId).stream()
                .map(HistoryEntryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(entries));
    }
}
