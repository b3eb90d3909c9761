package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;

import java.util.Optional;

/**
 * Routes new edges into an existing PROCESS or DECISION node through a MERGE
 * node when that node would otherwise end up with more than one incoming edge,
 * which is what happens when a new step loops back into the graph.
 */
public class LoopFixStage implements TranslationStage {

    static final String LABEL_PREFIX = "Loop merge before ";

    private final IdGenerator idGenerator;

    public LoopFixStage(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return "loop-fix";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        if (!state.incremental()) {
            return state;
        }

        var next = state;
        for (ProcessNode target : state.existing().nodes()) {
            if (!target.is(NodeType.PROCESS) && !target.is(NodeType.DECISION)) {
                continue;
            }
            if (next.pendingEdgesInto(target.getId()).isEmpty() || next.effectiveIncoming(target.getId()) <= 1) {
                continue;
            }
            next = mergeBefore(next, target);
        }
        return next;
    }

    private TranslationState mergeBefore(TranslationState state, ProcessNode target) {
        var next = state;
        var bridge = bridgingMerge(state, target.getId());

        String mergeId;
        if (bridge.isPresent()) {
            mergeId = bridge.get().getSource();
        } else {
            var merge = Elements.node(idGenerator.nextId(), NodeType.MERGE, LABEL_PREFIX + target.getLabel());
            next = next.withNode(merge);
            mergeId = merge.getId();
        }

        for (ProcessEdge edge : state.survivingExistingEdges(edge -> edge.getTarget().equals(target.getId()))) {
            next = next.withDeletedEdge(edge.getId())
                    .withEdge(Elements.edge(idGenerator.nextId(), edge.getSource(), mergeId, edge.getCondition()));
        }
        for (ProcessEdge edge : state.pendingEdgesInto(target.getId())) {
            if (bridge.isPresent() && bridge.get().getId().equals(edge.getId())) {
                continue;
            }
            next = next.withEdge(edge.withTarget(mergeId));
        }

        if (bridge.isEmpty()) {
            next = next.withEdge(Elements.edge(idGenerator.nextId(), mergeId, target.getId()));
        }
        return next;
    }

    /**
     * A pending edge into the target whose source is a MERGE proposed in this batch.
     */
    private Optional<ProcessEdge> bridgingMerge(TranslationState state, String targetId) {
        return state.pendingEdgesInto(targetId).stream()
                .filter(edge -> state.pendingNode(edge.getSource())
                        .map(node -> node.is(NodeType.MERGE))
                        .orElse(false))
                .findFirst();
    }
}
