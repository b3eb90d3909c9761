package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;

/**
 * Joins several dead-end PROCESS nodes of the existing graph into the first
 * new PROCESS node through one MERGE node.
 *
 * Other proposed edges into that PROCESS node are dropped; the ones coming
 * from a new DECISION or MERGE are routed into the convergence MERGE instead
 * so those nodes keep their outgoing edge.
 */
public class ConvergenceFixStage implements TranslationStage {

    static final String LABEL_PREFIX = "Convergence before ";

    private final IdGenerator idGenerator;

    public ConvergenceFixStage(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return "convergence-fix";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        if (!state.incremental()) {
            return state;
        }

        var dangling = state.existing().nodes().stream()
                .filter(node -> node.is(NodeType.PROCESS))
                .filter(node -> state.effectiveOutgoing(node.getId()) == 0)
                .toList();
        var firstNewProcess = state.pendingNodes().stream()
                .filter(node -> TerminalPolicy.resolvedType(state, node) == NodeType.PROCESS)
                .findFirst();
        if (dangling.size() < 2 || firstNewProcess.isEmpty()) {
            return state;
        }

        ProcessNode target = firstNewProcess.get();
        var merge = Elements.node(idGenerator.nextId(), NodeType.MERGE, LABEL_PREFIX + target.getLabel());
        var next = state.withNode(merge);

        for (ProcessEdge edge : state.pendingEdgesInto(target.getId())) {
            var sourceType = TerminalPolicy.resolvedType(state, edge.getSource());
            if (sourceType == NodeType.DECISION || sourceType == NodeType.MERGE) {
                next = next.withEdge(edge.withTarget(merge.getId()));
            } else {
                next = next.withoutPendingEdge(edge.getId());
            }
        }
        for (ProcessNode node : dangling) {
            next = next.withEdge(Elements.edge(idGenerator.nextId(), node.getId(), merge.getId()));
        }
        return next.withEdge(Elements.edge(idGenerator.nextId(), merge.getId(), target.getId()));
    }
}
