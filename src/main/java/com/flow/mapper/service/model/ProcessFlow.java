package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a process graph.
 *
 * Node and edge order carry no meaning for validity but are used for
 * deterministic tie-breaks. A new snapshot is produced for every change;
 * earlier snapshots stay valid for readers and rollback.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessFlow(
        List<ProcessNode> nodes,
        List<ProcessEdge> edges,
        Instant createdAt,
        Instant updatedAt
) {

    public ProcessFlow {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static ProcessFlow empty() {
        return new ProcessFlow(List.of(), List.of(), null, null);
    }

    public static ProcessFlow of(List<ProcessNode> nodes, List<ProcessEdge> edges) {
        return new ProcessFlow(nodes, edges, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Structural problems that make the snapshot unusable: missing or duplicate
     * ids, nodes without a type, repeated node pairs and edges whose endpoints
     * are not part of the graph.
     *
     * @return one readable message per problem, empty when the snapshot is well formed
     */
    public List<String> integrityProblems() {
        var problems = new ArrayList<String>();

        var nodeIds = new HashSet<String>();
        for (int index = 0; index < nodes.size(); index++) {
            var node = nodes.get(index);
            if (node.getId() == null || node.getId().isBlank()) {
                problems.add("Node #" + index + " has no id");
                continue;
            }
            if (!nodeIds.add(node.getId())) {
                problems.add("Duplicate node id '" + node.getId() + "'");
            }
            if (node.getType() == null) {
                problems.add("Node '" + node.getId() + "' has no type");
            }
        }

        var edgeIds = new HashSet<String>();
        var pairs = new HashSet<String>();
        for (int index = 0; index < edges.size(); index++) {
            var edge = edges.get(index);
            if (edge.getId() == null || edge.getId().isBlank()) {
                problems.add("Edge #" + index + " has no id");
                continue;
            }
            if (!edgeIds.add(edge.getId())) {
                problems.add("Duplicate edge id '" + edge.getId() + "'");
            }
            if (!nodeIds.contains(edge.getSource())) {
                problems.add("Edge '" + edge.getId() + "' source '" + edge.getSource() + "' not found");
            }
            if (!nodeIds.contains(edge.getTarget())) {
                problems.add("Edge '" + edge.getId() + "' target '" + edge.getTarget() + "' not found");
            }
            if (!pairs.add(edge.getSource() + "->" + edge.getTarget())) {
                problems.add("Edge '" + edge.getId() + "' repeats the connection from '"
                        + edge.getSource() + "' to '" + edge.getTarget() + "'");
            }
        }
        return problems;
    }

    public Optional<ProcessNode> findNode(String nodeId) {
        return nodes.stream()
                .filter(node -> node.getId().equals(nodeId))
                .findFirst();
    }

    public Optional<ProcessEdge> findEdge(String edgeId) {
        return edges.stream()
                .filter(edge -> edge.getId().equals(edgeId))
                .findFirst();
    }

    public List<ProcessEdge> outgoingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.getSource().equals(nodeId))
                .toList();
    }

    public List<ProcessEdge> incomingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> edge.getTarget().equals(nodeId))
                .toList();
    }

    public long outgoingCount(String nodeId) {
        return edges.stream().filter(edge -> edge.getSource().equals(nodeId)).count();
    }

    public long incomingCount(String nodeId) {
        return edges.stream().filter(edge -> edge.getTarget().equals(nodeId)).count();
    }

    public List<ProcessNode> nodesOfType(NodeType type) {
        return nodes.stream()
                .filter(node -> node.is(type))
                .toList();
    }

    public ProcessFlow withNodes(List<ProcessNode> newNodes) {
        return new ProcessFlow(newNodes, edges, createdAt, updatedAt);
    }

    public ProcessFlow withUpdatedAt(Instant timestamp) {
        return new ProcessFlow(nodes, edges, createdAt, timestamp);
    }
}
