package com.flow.mapper.service.api.controller;

import com.flow.mapper.service.api.dto.ApiResponse;
import com.flow.mapper.service.api.dto.CreateFlowRequest;
import com.flow.mapper.service.api.dto.FlowDetailResponse;
import com.flow.mapper.service.api.dto.FlowResponses;
import com.flow.mapper.service.api.dto.FlowSummaryResponse;
import com.flow.mapper.service.api.dto.ViolationResponse;
import com.flow.mapper.service.engine.FlowEditingService;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.topology.TopologyValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Controller for flow management.
 * Handles flow creation, listing, retrieval, validation, relabeling and deletion.
 */
@Slf4j
@RestController
@Tag(name = "Flows", description = "Endpoints for creating, querying and validating flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowEditingService editingService;
    private final TopologyValidator topologyValidator;

    // ==================== Endpoints ====================

    @PostMapping("/flows")
    @Operation(summary = "Create a flow", description = "Creates an empty flow, or one seeded from the given nodes and edges")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Flow created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ApiResponse<FlowDetailResponse>> createFlow(
            @Valid @RequestBody(required = false) CreateFlowRequest request) {
        var name = request != null ? request.getName() : null;
        var initial = request != null ? request.toFlow() : ProcessFlow.empty();

        var entry = editingService.createFlow(name, initial);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(FlowResponses.detail(entry, topologyValidator)));
    }

    @GetMapping("/flows")
    @Operation(summary = "List all flows", description = "Returns summaries of all flows in the store")
    public ResponseEntity<ApiResponse<List<FlowSummaryResponse>>> getAllFlows() {
        log.debug("Listing all flows");

        var summaries = editingService.listFlows().stream()
                .sorted(Comparator.comparing(entry -> entry.createdAt()))
                .map(entry -> FlowResponses.summary(entry, topologyValidator))
                .toList();

        log.info("Returning {} flow summaries", summaries.size());
        return ResponseEntity.ok(ApiResponse.success(summaries));
    }

    @GetMapping("/flows/{flowId}")
    @Operation(summary = "Get flow by ID", description = "Returns the flow with nodes, edges and topology violations")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Flow found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Flow not found")
    })
    public ResponseEntity<ApiResponse<FlowDetailResponse>> getFlowById(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        log.debug("Getting flow: {}", flowId);
        var entry = editingService.getFlow(flowId);
        return ResponseEntity.ok(ApiResponse.success(FlowResponses.detail(entry, topologyValidator)));
    }

    @DeleteMapping("/flows/{flowId}")
    @Operation(summary = "Delete flow", description = "Removes a flow and its patch history")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Flow deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Flow not found")
    })
    public ResponseEntity<Void> deleteFlow(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        log.debug("Deleting flow: {}", flowId);
        editingService.deleteFlow(flowId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/flows/{flowId}/violations")
    @Operation(summary = "Validate flow", description = "Checks the flow against the node degree rules")
    public ResponseEntity<ApiResponse<List<ViolationResponse>>> getViolations(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        var violations = editingService.validate(flowId);
        log.debug("Flow {} has {} violations", flowId, violations.size());
        return ResponseEntity.ok(ApiResponse.success(ViolationResponse.fromAll(violations)));
    }

    @PostMapping("/flows/{flowId}/relabel")
    @Operation(summary = "Relabel flow", description = "Renumbers PROCESS steps (1.1.1.n) in flow order")
    public ResponseEntity<ApiResponse<FlowDetailResponse>> relabel(
            @Parameter(description = "Flow ID") @PathVariable String flowId) {
        var entry = editingService.relabel(flowId);
        return ResponseEntity.ok(ApiResponse.success(FlowResponses.detail(entry, topologyValidator)));
    }
}
