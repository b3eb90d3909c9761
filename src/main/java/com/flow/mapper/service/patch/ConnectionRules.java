package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.topology.TopologyRules;

import java.util.Optional;

/**
 * Per-edge legality checks run by {@code add_edge} and by {@code update_edge}
 * when it moves an edge.
 *
 * Extra incoming edges on PROCESS and DECISION nodes are allowed here and
 * absorbed later by {@link MergeNodeInserter}.
 */
final class ConnectionRules {

    private ConnectionRules() {
    }

    /**
     * @return the reason the connection is illegal, or empty when it may be added
     */
    static Optional<String> check(MutableFlow flow, ProcessNode source, ProcessNode target) {
        return check(flow, source, target, null);
    }

    /**
     * @param movedEdgeId edge being re-pointed; it does not count against the source
     */
    static Optional<String> check(MutableFlow flow, ProcessNode source, ProcessNode target, String movedEdgeId) {
        long sourceOutgoing = flow.outgoingCount(source.getId(), movedEdgeId);

        String sourceProblem = switch (source.getType()) {
            case START -> sourceOutgoing >= 1
                    ? "START node '" + source.getId() + "' already has an outgoing edge"
                    : null;
            case END -> "END node '" + source.getId() + "' cannot have outgoing edges";
            case PROCESS -> sourceOutgoing >= 1
                    ? "PROCESS node '" + source.getId() + "' already has an outgoing edge; "
                    + "use a DECISION node for branching"
                    : null;
            case DECISION -> sourceOutgoing >= TopologyRules.MAX_DECISION_BRANCHES
                    ? "DECISION node '" + source.getId() + "' already has "
                    + TopologyRules.MAX_DECISION_BRANCHES + " outgoing edges"
                    : null;
            case MERGE -> null;
        };
        if (sourceProblem != null) {
            return Optional.of(sourceProblem);
        }

        return switch (target.getType()) {
            case START -> Optional.of("START node '" + target.getId() + "' cannot have incoming edges");
            case PROCESS, DECISION, MERGE, END -> Optional.empty();
        };
    }
}
