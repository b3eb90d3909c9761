package com.flow.mapper.service.observability;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.topology.TopologyViolation;

import java.util.List;

/**
 * Receives structured events from the patch engine and the intent translator.
 *
 * The core never logs on its own; whoever embeds it decides what to do with
 * these events. All methods default to no-ops.
 */
public interface FlowEventListener {

    FlowEventListener NOOP = new FlowEventListener() {
    };

    default void onPatchApplied(FlowPatch patch, List<TopologyViolation> remainingViolations) {
    }

    default void onPatchRejected(FlowPatch patch, int operationIndex, String reason) {
    }

    default void onMergeInserted(String targetNodeId, String mergeNodeId, int redirectedEdges) {
    }

    default void onTranslationStage(String stage, int pendingOperations) {
    }

    default void onTranslationRepair(int attempt, List<TopologyViolation> violations, int repairOperations) {
    }

    default void onTranslationCompleted(FlowPatch patch, boolean incremental, List<TopologyViolation> remainingViolations) {
    }

    default void onTranslationRejected(String reason, String message) {
    }

    /**
     * A translated operation the engine refused was left out of the patch.
     */
    default void onOperationDropped(int operationIndex, String reason) {
    }

    /**
     * A flow of the intent could not be turned into an edge.
     */
    default void onFlowSkipped(String fromStep, String toStep, String reason) {
    }
}
