package com.flow.mapper.service.topology;

import com.flow.mapper.service.model.NodeType;

/**
 * One breach of the graph's structural rules.
 *
 * @param kind      degree breach or an edge pointing at a missing node
 * @param elementId offending node id (degree) or edge id (dangling edge)
 * @param nodeType  type of the offending node, {@code null} for dangling edges
 * @param direction which side of the node/edge is wrong
 * @param expected  allowed degree range, {@code null} for dangling edges
 * @param actual    observed degree, 0 for dangling edges
 * @param message   human readable description
 */
public record TopologyViolation(
        Kind kind,
        String elementId,
        NodeType nodeType,
        Direction direction,
        DegreeRange expected,
        long actual,
        String message
) {

    public enum Kind {
        DEGREE,
        DANGLING_EDGE
    }

    public enum Direction {
        INCOMING,
        OUTGOING
    }

    public static TopologyViolation degree(String nodeId, NodeType type, Direction direction,
                                           DegreeRange expected, long actual) {
        String side = direction == Direction.INCOMING ? "incoming" : "outgoing";
        String message = String.format("%s node '%s' must have %s %s (has %d)",
                type.name(), nodeId, expected.describe(), side, actual);
        return new TopologyViolation(Kind.DEGREE, nodeId, type, direction, expected, actual, message);
    }

    public static TopologyViolation danglingEdge(String edgeId, String missingNodeId, Direction endpoint) {
        String side = endpoint == Direction.OUTGOING ? "source" : "target";
        String message = String.format("Edge '%s' %s '%s' not found", edgeId, side, missingNodeId);
        return new TopologyViolation(Kind.DANGLING_EDGE, edgeId, null, endpoint, null, 0, message);
    }

    public boolean concerns(NodeType type, Direction side) {
        return kind == Kind.DEGREE && nodeType == type && direction == side;
    }

    public boolean isBelowMinimum() {
        return expected != null && actual < expected.min();
    }
}
