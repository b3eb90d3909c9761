package com.flow.mapper.service.topology;

import com.flow.mapper.service.model.NodeType;

/**
 * Degree table for each node type.
 */
public final class TopologyRules {

    public static final int MAX_DECISION_BRANCHES = 4;
    public static final int MIN_DECISION_BRANCHES = 2;

    private TopologyRules() {
    }

    public static DegreeRange incoming(NodeType type) {
        return switch (type) {
            case START -> DegreeRange.exactly(0);
            case END -> DegreeRange.atLeast(1);
            case PROCESS, DECISION -> DegreeRange.exactly(1);
            case MERGE -> DegreeRange.atLeast(2);
        };
    }

    public static DegreeRange outgoing(NodeType type) {
        return switch (type) {
            case START -> DegreeRange.exactly(1);
            case END -> DegreeRange.exactly(0);
            case PROCESS -> DegreeRange.atMost(1);
            case DECISION -> DegreeRange.between(MIN_DECISION_BRANCHES, MAX_DECISION_BRANCHES);
            case MERGE -> DegreeRange.atLeast(1);
        };
    }
}
