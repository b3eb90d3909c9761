package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessNode;

import java.util.List;
import java.util.Optional;

/**
 * Settles the START and END nodes of the batch according to {@link TerminalPolicy}.
 *
 * In fresh mode a graph without START gets one, wired to the step the
 * process begins with.
 */
public class TerminalNormalizationStage implements TranslationStage {

    static final String START_LABEL = "Start process";

    private static final List<NodeType> ENTRY_PREFERENCE =
            List.of(NodeType.PROCESS, NodeType.DECISION, NodeType.MERGE);

    private final IdGenerator idGenerator;

    public TerminalNormalizationStage(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return "terminal-normalization";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        var next = state;
        for (ProcessNode node : state.pendingNodes()) {
            var resolved = TerminalPolicy.resolvedType(state, node);
            if (resolved != node.getType()) {
                next = next.withNode(node.withType(resolved));
            }
        }

        if (next.incremental() || next.pendingNodes().stream().anyMatch(node -> node.is(NodeType.START))) {
            return next;
        }
        return synthesizeStart(next);
    }

    private TranslationState synthesizeStart(TranslationState state) {
        var start = Elements.node(idGenerator.nextId(), NodeType.START, START_LABEL);
        var next = state.withLeadingNode(start);

        var entry = entryNode(state);
        if (entry.isPresent()) {
            next = next.withEdge(Elements.edge(idGenerator.nextId(), start.getId(), entry.get().getId()));
        }
        return next;
    }

    /**
     * The step a start was inferred for, otherwise the first node nothing flows
     * into, preferring PROCESS over DECISION over MERGE.
     */
    private Optional<ProcessNode> entryNode(TranslationState state) {
        var unreached = state.pendingNodes().stream()
                .filter(node -> state.effectiveIncoming(node.getId()) == 0)
                .toList();

        var inferred = unreached.stream()
                .filter(node -> state.inferredStartNodeIds().contains(node.getId()))
                .findFirst();
        if (inferred.isPresent()) {
            return inferred;
        }

        for (NodeType type : ENTRY_PREFERENCE) {
            var candidate = unreached.stream().filter(node -> node.is(type)).findFirst();
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }
}
