package com.flow.mapper.service.api.dto;

import com.flow.mapper.service.engine.FlowStore.FlowEntry;
import com.flow.mapper.service.patch.PatchResult;
import com.flow.mapper.service.topology.TopologyValidator;
import com.flow.mapper.service.translate.Translation;

/**
 * Maps service results to API DTOs.
 */
public final class FlowResponses {

    private FlowResponses() {
    }

    public static FlowSummaryResponse summary(FlowEntry entry, TopologyValidator validator) {
        return FlowSummaryResponse.builder()
                .flowId(entry.flowId())
                .name(entry.name())
                .revision(entry.revision())
                .nodeCount(entry.flow().nodes().size())
                .edgeCount(entry.flow().edges().size())
                .valid(validator.isValid(entry.flow()))
                .createdAt(entry.createdAt())
                .lastUpdatedAt(entry.updatedAt())
                .build();
    }

    public static FlowDetailResponse detail(FlowEntry entry, TopologyValidator validator) {
        return FlowDetailResponse.builder()
                .flowId(entry.flowId())
                .name(entry.name())
                .revision(entry.revision())
                .createdAt(entry.createdAt())
                .lastUpdatedAt(entry.updatedAt())
                .nodes(entry.flow().nodes())
                .edges(entry.flow().edges())
                .violations(ViolationResponse.fromAll(validator.validate(entry.flow())))
                .build();
    }

    public static PatchResponse applied(FlowEntry entry, PatchResult result, TopologyValidator validator) {
        return PatchResponse.builder()
                .flowId(entry.flowId())
                .revision(entry.revision())
                .source(result.patch().source())
                .operationCount(result.patch().size())
                .mergesInserted(result.mergesInserted())
                .appliedAt(result.patch().appliedAt())
                .violations(ViolationResponse.fromAll(result.violations()))
                .flow(detail(entry, validator))
                .build();
    }

    public static PatchResponse preview(String flowId, PatchResult result) {
        return PatchResponse.builder()
                .flowId(flowId)
                .source(result.patch().source())
                .operationCount(result.patch().size())
                .mergesInserted(result.mergesInserted())
                .appliedAt(result.patch().appliedAt())
                .violations(ViolationResponse.fromAll(result.violations()))
                .flow(FlowDetailResponse.builder()
                        .flowId(flowId)
                        .nodes(result.flow().nodes())
                        .edges(result.flow().edges())
                        .violations(ViolationResponse.fromAll(result.violations()))
                        .build())
                .build();
    }

    public static TranslationResponse translation(Translation translation) {
        return TranslationResponse.builder()
                .mode(translation.incremental() ? "incremental" : "fresh")
                .patch(translation.patch())
                .preview(translation.preview())
                .repairRounds(translation.repairRounds())
                .violations(ViolationResponse.fromAll(translation.remainingViolations()))
                .build();
    }
}
