package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hooks the most important unreached new node onto the existing graph.
 *
 * The anchor is the most recent existing PROCESS without outgoing edges, else
 * the most recent existing PROCESS (its current outgoing edge is cut), else
 * START if it has nothing after it yet. Without an existing graph there is
 * nothing to anchor to and the stage does nothing.
 */
public class DanglingConnectionStage implements TranslationStage {

    private static final List<NodeType> PRIORITY = List.of(NodeType.DECISION, NodeType.MERGE, NodeType.PROCESS);

    private final IdGenerator idGenerator;

    public DanglingConnectionStage(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return "dangling-connection";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        if (!state.incremental()) {
            return state;
        }

        var candidate = state.pendingNodes().stream()
                .filter(node -> PRIORITY.contains(node.getType()))
                .filter(node -> state.effectiveIncoming(node.getId()) == 0)
                .min(Comparator.comparingInt(node -> PRIORITY.indexOf(node.getType())));
        if (candidate.isEmpty()) {
            return state;
        }

        var anchor = anchor(state);
        if (anchor.isEmpty()) {
            return state;
        }

        var next = state;
        String anchorId = anchor.get().getId();
        if (anchor.get().is(NodeType.PROCESS)) {
            for (ProcessEdge edge : state.survivingExistingEdges(edge -> edge.getSource().equals(anchorId))) {
                next = next.withDeletedEdge(edge.getId());
            }
            for (ProcessEdge edge : state.pendingEdgesFrom(anchorId)) {
                next = next.withoutPendingEdge(edge.getId());
            }
        }
        return next.withEdge(Elements.edge(idGenerator.nextId(), anchorId, candidate.get().getId()));
    }

    private Optional<ProcessNode> anchor(TranslationState state) {
        var processes = state.existing().nodesOfType(NodeType.PROCESS);

        for (int i = processes.size() - 1; i >= 0; i--) {
            if (state.effectiveOutgoing(processes.get(i).getId()) == 0) {
                return Optional.of(processes.get(i));
            }
        }
        if (!processes.isEmpty()) {
            return Optional.of(processes.get(processes.size() - 1));
        }
        return state.existing().nodesOfType(NodeType.START).stream()
                .filter(start -> state.effectiveOutgoing(start.getId()) == 0)
                .findFirst();
    }
}
