package com.flow.mapper.service.api.controller;

import com.flow.mapper.service.api.dto.ApiResponse;
import com.flow.mapper.service.api.dto.FlowResponses;
import com.flow.mapper.service.api.dto.TranslateIntentRequest;
import com.flow.mapper.service.api.dto.TranslationResponse;
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
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for intent translation.
 */
@Slf4j
@RestController
@Tag(name = "Intent", description = "Endpoints for turning process intents into patches")
@RequiredArgsConstructor
public class IntentController {

    private final FlowEditingService editingService;
    private final TopologyValidator topologyValidator;

    @PostMapping("/intent/translate")
    @Operation(summary = "Translate intent",
               description = "Returns the patch for an intent, optionally against a supplied graph, without storing anything")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Intent translated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Intent rejected")
    })
    public ResponseEntity<ApiResponse<TranslationResponse>> translate(
            @Valid @RequestBody TranslateIntentRequest request) {
        log.debug("Translating intent with {} steps", request.getIntent().steps().size());
        var translation = editingService.translate(request.getIntent(), request.getExisting());
        return ResponseEntity.ok(ApiResponse.success(FlowResponses.translation(translation)));
    }

    @PostMapping("/flows/{flowId}/intent")
    @Operation(summary = "Apply intent", description = "Translates an intent against the flow and applies the patch")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Intent applied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Intent rejected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Flow not found")
    })
    public ResponseEntity<ApiResponse<TranslationResponse>> applyIntent(
            @Parameter(description = "Flow ID") @PathVariable String flowId,
            @Valid @RequestBody TranslateIntentRequest request) {
        var outcome = editingService.applyIntent(flowId, request.getIntent());

        var response = FlowResponses.translation(outcome.translation());
        response.setApplied(FlowResponses.applied(outcome.entry(), outcome.result(), topologyValidator));
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
