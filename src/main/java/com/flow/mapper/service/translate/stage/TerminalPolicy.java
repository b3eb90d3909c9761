package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessNode;

/**
 * Which START and END nodes proposed by a translation survive.
 *
 * Incremental mode keeps none of them: the graph being extended already owns
 * its terminals. Fresh mode keeps the first explicit START and the first END;
 * inferred starts and any extra terminal become PROCESS.
 */
public final class TerminalPolicy {

    private TerminalPolicy() {
    }

    /**
     * Type the node will have once terminals are normalized. Existing nodes keep their type.
     */
    public static NodeType resolvedType(TranslationState state, ProcessNode node) {
        if (state.isExisting(node.getId())) {
            return node.getType();
        }
        return switch (node.getType()) {
            case START -> keepsStart(state, node) ? NodeType.START : NodeType.PROCESS;
            case END -> keepsEnd(state, node) ? NodeType.END : NodeType.PROCESS;
            case PROCESS, DECISION, MERGE -> node.getType();
        };
    }

    public static NodeType resolvedType(TranslationState state, String nodeId) {
        return state.node(nodeId)
                .map(node -> resolvedType(state, node))
                .orElse(NodeType.PROCESS);
    }

    private static boolean keepsStart(TranslationState state, ProcessNode node) {
        if (state.incremental() || state.inferredStartNodeIds().contains(node.getId())) {
            return false;
        }
        return state.pendingNodes().stream()
                .filter(candidate -> candidate.is(NodeType.START))
                .filter(candidate -> !state.inferredStartNodeIds().contains(candidate.getId()))
                .findFirst()
                .map(first -> first.getId().equals(node.getId()))
                .orElse(false);
    }

    private static boolean keepsEnd(TranslationState state, ProcessNode node) {
        if (state.incremental()) {
            return false;
        }
        return state.pendingNodes().stream()
                .filter(candidate -> candidate.is(NodeType.END))
                .findFirst()
                .map(first -> first.getId().equals(node.getId()))
                .orElse(false);
    }
}
