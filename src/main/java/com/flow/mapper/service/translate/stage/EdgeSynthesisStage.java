package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.topology.TopologyRules;
import com.flow.mapper.service.translate.IntentFlow;
import com.flow.mapper.service.translate.LabelSimilarity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns intent flows into {@code add_edge} operations.
 *
 * A PROCESS source keeps a single outgoing edge (the last flow wins). A
 * START source that is already connected keeps its edge and the flow is
 * skipped. DECISION sources collect up to four branches. When several new
 * edges land on the same node they are routed through one MERGE node.
 */
public class EdgeSynthesisStage implements TranslationStage {

    static final String MERGE_LABEL_PREFIX = "Merge before ";

    private final IdGenerator idGenerator;
    private final FlowEventListener listener;

    public EdgeSynthesisStage(IdGenerator idGenerator, FlowEventListener listener) {
        this.idGenerator = idGenerator;
        this.listener = listener;
    }

    @Override
    public String name() {
        return "edge-synthesis";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        var next = state;
        Set<String> proposedPairs = new HashSet<>();

        for (IntentFlow flow : state.intent().flows()) {
            next = connect(next, flow, proposedPairs);
        }
        return insertBatchMerges(next);
    }

    // ==================== Flows ====================

    private TranslationState connect(TranslationState state, IntentFlow flow, Set<String> proposedPairs) {
        var source = resolve(state, flow.fromStep());
        var target = resolve(state, flow.toStep());
        if (source.isEmpty() || target.isEmpty()) {
            return skip(state, flow, "unknown step");
        }

        String sourceId = source.get();
        String targetId = target.get();
        if (sourceId.equals(targetId)) {
            return skip(state, flow, "self loop");
        }
        if (!proposedPairs.add(pairKey(sourceId, targetId))) {
            return skip(state, flow, "duplicate flow");
        }
        if (!state.survivingExistingEdges(edge -> edge.connects(sourceId, targetId)).isEmpty()) {
            return skip(state, flow, "already connected");
        }

        var sourceType = TerminalPolicy.resolvedType(state, sourceId);
        if (sourceType == NodeType.END) {
            return skip(state, flow, "END cannot have outgoing edges");
        }
        if (TerminalPolicy.resolvedType(state, targetId) == NodeType.START) {
            return skip(state, flow, "START cannot have incoming edges");
        }

        if (sourceType == NodeType.START && state.effectiveOutgoing(sourceId) > 0) {
            return skip(state, flow, "START already has an outgoing edge");
        }

        var next = state;
        if (sourceType == NodeType.PROCESS) {
            next = dropOutgoing(next, sourceId, proposedPairs);
        } else if (sourceType == NodeType.DECISION
                && next.effectiveOutgoing(sourceId) >= TopologyRules.MAX_DECISION_BRANCHES) {
            return skip(state, flow, "DECISION already has " + TopologyRules.MAX_DECISION_BRANCHES + " branches");
        }

        return next.withEdge(Elements.edge(idGenerator.nextId(), sourceId, targetId, flow.condition()));
    }

    private TranslationState dropOutgoing(TranslationState state, String sourceId, Set<String> proposedPairs) {
        var next = state;
        for (ProcessEdge edge : state.survivingExistingEdges(edge -> edge.getSource().equals(sourceId))) {
            next = next.withDeletedEdge(edge.getId());
        }
        for (ProcessEdge edge : state.pendingEdgesFrom(sourceId)) {
            next = next.withoutPendingEdge(edge.getId());
            proposedPairs.remove(pairKey(edge.getSource(), edge.getTarget()));
        }
        return next;
    }

    private TranslationState skip(TranslationState state, IntentFlow flow, String reason) {
        listener.onFlowSkipped(flow.fromStep(), flow.toStep(), reason);
        return state;
    }

    /**
     * Step id first, then a case-insensitive label lookup over existing and then new nodes.
     */
    static Optional<String> resolve(TranslationState state, String stepReference) {
        if (stepReference == null) {
            return Optional.empty();
        }
        var mapped = state.stepNodeIds().get(stepReference);
        if (mapped != null) {
            return Optional.of(mapped);
        }

        var wanted = LabelSimilarity.normalize(stepReference);
        return Stream.concat(state.existing().nodes().stream(), state.pendingNodes().stream())
                .filter(node -> LabelSimilarity.normalize(node.getLabel()).equals(wanted))
                .map(ProcessNode::getId)
                .findFirst();
    }

    // ==================== Batch Merges ====================

    private TranslationState insertBatchMerges(TranslationState state) {
        Map<String, List<ProcessEdge>> byTarget = new LinkedHashMap<>();
        for (ProcessEdge edge : state.pendingEdges()) {
            byTarget.computeIfAbsent(edge.getTarget(), key -> new ArrayList<>()).add(edge);
        }

        var next = state;
        for (var entry : byTarget.entrySet()) {
            if (entry.getValue().size() < 2) {
                continue;
            }
            String targetId = entry.getKey();
            String label = state.node(targetId).map(ProcessNode::getLabel).orElse(targetId);
            var merge = Elements.node(idGenerator.nextId(), NodeType.MERGE, MERGE_LABEL_PREFIX + label);

            next = next.withNode(merge);
            for (ProcessEdge edge : entry.getValue()) {
                next = next.withEdge(edge.withTarget(merge.getId()));
            }
            next = next.withEdge(Elements.edge(idGenerator.nextId(), merge.getId(), targetId));
        }
        return next;
    }

    private static String pairKey(String sourceId, String targetId) {
        return sourceId + "->" + targetId;
    }
}
