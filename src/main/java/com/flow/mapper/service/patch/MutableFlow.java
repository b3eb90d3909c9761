package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scratch copy of a graph that a patch is applied to. Never escapes the
 * package; it is turned back into an immutable {@link ProcessFlow} once the
 * whole patch succeeded.
 */
final class MutableFlow {

    private final Map<String, ProcessNode> nodes = new LinkedHashMap<>();
    private final List<ProcessEdge> edges = new ArrayList<>();
    private final Instant createdAt;

    private MutableFlow(Instant createdAt) {
        this.createdAt = createdAt;
    }

    static MutableFlow copyOf(ProcessFlow flow) {
        var copy = new MutableFlow(flow.createdAt());
        flow.nodes().forEach(node -> copy.nodes.put(node.getId(), node));
        copy.edges.addAll(flow.edges());
        return copy;
    }

    ProcessFlow snapshot(Instant now) {
        return new ProcessFlow(
                List.copyOf(nodes.values()),
                List.copyOf(edges),
                createdAt != null ? createdAt : now,
                now);
    }

    // ==================== Nodes ====================

    boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    ProcessNode node(String nodeId) {
        return nodes.get(nodeId);
    }

    Collection<ProcessNode> nodes() {
        return nodes.values();
    }

    void putNode(ProcessNode node) {
        nodes.put(node.getId(), node);
    }

    /**
     * Removes the node and every edge touching it.
     */
    void removeNode(String nodeId) {
        nodes.remove(nodeId);
        edges.removeIf(edge -> edge.touches(nodeId));
    }

    // ==================== Edges ====================

    boolean containsEdge(String edgeId) {
        return indexOfEdge(edgeId) >= 0;
    }

    ProcessEdge edge(String edgeId) {
        int index = indexOfEdge(edgeId);
        return index >= 0 ? edges.get(index) : null;
    }

    List<ProcessEdge> edges() {
        return edges;
    }

    boolean containsPair(String source, String target) {
        return containsPair(source, target, null);
    }

    /**
     * Pair lookup that ignores the edge with {@code excludedEdgeId}.
     */
    boolean containsPair(String source, String target, String excludedEdgeId) {
        return edges.stream()
                .filter(edge -> excludedEdgeId == null || !excludedEdgeId.equals(edge.getId()))
                .anyMatch(edge -> edge.connects(source, target));
    }

    void addEdge(ProcessEdge edge) {
        edges.add(edge);
    }

    void replaceEdge(ProcessEdge edge) {
        edges.set(indexOfEdge(edge.getId()), edge);
    }

    void removeEdge(String edgeId) {
        edges.removeIf(edge -> edge.getId().equals(edgeId));
    }

    long outgoingCount(String nodeId) {
        return outgoingCount(nodeId, null);
    }

    long outgoingCount(String nodeId, String excludedEdgeId) {
        return edges.stream()
                .filter(edge -> excludedEdgeId == null || !excludedEdgeId.equals(edge.getId()))
                .filter(edge -> edge.getSource().equals(nodeId))
                .count();
    }

    long incomingCount(String nodeId) {
        return edges.stream().filter(edge -> edge.getTarget().equals(nodeId)).count();
    }

    List<ProcessEdge> incomingEdges(String nodeId) {
        return edges.stream().filter(edge -> edge.getTarget().equals(nodeId)).toList();
    }

    private int indexOfEdge(String edgeId) {
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).getId().equals(edgeId)) {
                return i;
            }
        }
        return -1;
    }
}
