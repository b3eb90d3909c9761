package com.flow.mapper.service.labeling;

import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns hierarchical logical ids ({@code 1.1.1.<n>}) to PROCESS nodes in flow order.
 *
 * Only PROCESS nodes are numbered; other node types keep whatever logical id
 * they already carry.
 */
public class SequentialLabeler {

    public static final String PREFIX = "1.1.1.";

    // ==================== Full Pass ====================

    /**
     * Renumbers PROCESS nodes breadth-first from every node without incoming
     * edges (node order), following outgoing edges in edge order. Nodes not
     * reached from any entry are numbered afterwards in their original order.
     *
     * @return a new graph; the input is left untouched
     */
    public ProcessFlow relabel(ProcessFlow flow) {
        if (flow.isEmpty()) {
            return flow;
        }

        var order = flowOrder(flow);
        var labels = new HashMap<String, String>();
        int counter = 0;
        for (String nodeId : order) {
            var node = flow.findNode(nodeId).orElseThrow();
            if (node.is(NodeType.PROCESS)) {
                labels.put(nodeId, PREFIX + (++counter));
            }
        }

        var relabeled = flow.nodes().stream()
                .map(node -> labels.containsKey(node.getId())
                        ? node.withLogicalId(labels.get(node.getId()))
                        : node)
                .toList();
        return flow.withNodes(relabeled);
    }

    /**
     * Visit order used by {@link #relabel}: reachable nodes in BFS order, then the rest.
     */
    public List<String> flowOrder(ProcessFlow flow) {
        var successors = successors(flow);
        var entries = entryNodes(flow);

        Set<String> visited = new LinkedHashSet<>();
        var queue = new ArrayDeque<String>();
        for (String entry : entries) {
            if (visited.add(entry)) {
                queue.add(entry);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }

        var order = new ArrayList<>(visited);
        for (ProcessNode node : flow.nodes()) {
            if (!visited.contains(node.getId())) {
                order.add(node.getId());
            }
        }
        return order;
    }

    // ==================== Provisional Ids ====================

    /**
     * Next id of the simple counter used when a PROCESS node is added without
     * a logical id: one above the highest numbered {@code 1.1.1.<n>} among the
     * given nodes. Comparison is numeric, so {@code 1.1.1.10} ranks above {@code 1.1.1.9}.
     */
    public String nextProvisionalId(Collection<ProcessNode> nodes) {
        int highest = 0;
        for (ProcessNode node : nodes) {
            if (node.is(NodeType.PROCESS)) {
                highest = Math.max(highest, sequenceNumber(node.getLogicalId()));
            }
        }
        return PREFIX + (highest + 1);
    }

    static int sequenceNumber(String logicalId) {
        if (logicalId == null || !logicalId.startsWith(PREFIX)) {
            return 0;
        }
        String suffix = logicalId.substring(PREFIX.length());
        if (suffix.isEmpty() || suffix.length() > 9 || !suffix.chars().allMatch(Character::isDigit)) {
            return 0;
        }
        return Integer.parseInt(suffix);
    }

    // ==================== Helpers ====================

    private Map<String, List<String>> successors(ProcessFlow flow) {
        Map<String, List<String>> successors = new HashMap<>();
        for (ProcessEdge edge : flow.edges()) {
            successors.computeIfAbsent(edge.getSource(), key -> new ArrayList<>()).add(edge.getTarget());
        }
        return successors;
    }

    private List<String> entryNodes(ProcessFlow flow) {
        Set<String> targets = new HashSet<>();
        flow.edges().forEach(edge -> targets.add(edge.getTarget()));

        var entries = flow.nodes().stream()
                .map(ProcessNode::getId)
                .filter(id -> !targets.contains(id))
                .toList();
        return entries.isEmpty() ? List.of(flow.nodes().get(0).getId()) : entries;
    }
}
