package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.PatchOperation;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.translate.ProcessIntent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable snapshot of a translation in progress: the graph being edited,
 * the operations proposed so far and the mapping from intent steps to nodes.
 *
 * Pending nodes and edges live only as {@code add_node} / {@code add_edge}
 * operations; stages rewrite those operations in place instead of stacking
 * updates on top of them. "Effective" queries look at the graph as it would
 * be once the pending operations land, ignoring merge insertion by the engine.
 *
 * @param intent               the intent being translated
 * @param existing             graph the patch will be applied to, empty in fresh mode
 * @param operations           proposed operations, in proposal order
 * @param stepNodeIds          intent step id to node id, for new and matched steps
 * @param inferredStartNodeIds new nodes typed START only because nothing flows into them
 */
public record TranslationState(
        ProcessIntent intent,
        ProcessFlow existing,
        List<PatchOperation> operations,
        Map<String, String> stepNodeIds,
        Set<String> inferredStartNodeIds
) {

    public TranslationState {
        operations = List.copyOf(operations);
        stepNodeIds = Map.copyOf(stepNodeIds);
        inferredStartNodeIds = Set.copyOf(inferredStartNodeIds);
    }

    public static TranslationState initial(ProcessIntent intent, ProcessFlow existing) {
        return new TranslationState(intent, existing == null ? ProcessFlow.empty() : existing,
                List.of(), Map.of(), Set.of());
    }

    /**
     * Incremental when there is a non-empty graph to extend, fresh otherwise.
     */
    public boolean incremental() {
        return !existing.isEmpty();
    }

    // ==================== Pending Elements ====================

    public List<ProcessNode> pendingNodes() {
        return operations.stream()
                .filter(PatchOperation.AddNode.class::isInstance)
                .map(op -> ((PatchOperation.AddNode) op).node())
                .toList();
    }

    public Optional<ProcessNode> pendingNode(String nodeId) {
        return pendingNodes().stream().filter(node -> node.getId().equals(nodeId)).findFirst();
    }

    public List<ProcessEdge> pendingEdges() {
        return operations.stream()
                .filter(PatchOperation.AddEdge.class::isInstance)
                .map(op -> ((PatchOperation.AddEdge) op).edge())
                .toList();
    }

    public Set<String> deletedEdgeIds() {
        var ids = new HashSet<String>();
        operations.stream()
                .filter(PatchOperation.DeleteEdge.class::isInstance)
                .forEach(op -> ids.add(((PatchOperation.DeleteEdge) op).edgeId()));
        return ids;
    }

    // ==================== Effective Graph ====================

    public boolean isExisting(String nodeId) {
        return existing.findNode(nodeId).isPresent();
    }

    public Optional<ProcessNode> node(String nodeId) {
        var pending = pendingNode(nodeId);
        return pending.isPresent() ? pending : existing.findNode(nodeId);
    }

    /**
     * Existing edges that survive pending deletions, followed by pending edges.
     */
    public List<ProcessEdge> effectiveEdges() {
        var deleted = deletedEdgeIds();
        return Stream.concat(
                        existing.edges().stream().filter(edge -> !deleted.contains(edge.getId())),
                        pendingEdges().stream())
                .toList();
    }

    public List<ProcessEdge> survivingExistingEdges(Predicate<ProcessEdge> filter) {
        var deleted = deletedEdgeIds();
        return existing.edges().stream()
                .filter(edge -> !deleted.contains(edge.getId()))
                .filter(filter)
                .toList();
    }

    public long effectiveIncoming(String nodeId) {
        return effectiveEdges().stream().filter(edge -> edge.getTarget().equals(nodeId)).count();
    }

    public long effectiveOutgoing(String nodeId) {
        return effectiveEdges().stream().filter(edge -> edge.getSource().equals(nodeId)).count();
    }

    public List<ProcessEdge> pendingEdgesFrom(String nodeId) {
        return pendingEdges().stream().filter(edge -> edge.getSource().equals(nodeId)).toList();
    }

    public List<ProcessEdge> pendingEdgesInto(String nodeId) {
        return pendingEdges().stream().filter(edge -> edge.getTarget().equals(nodeId)).toList();
    }

    // ==================== Transitions ====================

    public TranslationState withOperations(List<PatchOperation> newOperations) {
        return new TranslationState(intent, existing, newOperations, stepNodeIds, inferredStartNodeIds);
    }

    public TranslationState withStepNodeIds(Map<String, String> mapping) {
        return new TranslationState(intent, existing, operations, mapping, inferredStartNodeIds);
    }

    public TranslationState withInferredStartNodeIds(Set<String> ids) {
        return new TranslationState(intent, existing, operations, stepNodeIds, ids);
    }

    /**
     * Appends an {@code add_node}, or rewrites the pending one with the same id.
     */
    public TranslationState withNode(ProcessNode node) {
        var ops = new ArrayList<PatchOperation>(operations.size() + 1);
        boolean replaced = false;
        for (PatchOperation op : operations) {
            if (op instanceof PatchOperation.AddNode add && add.node().getId().equals(node.getId())) {
                ops.add(PatchOperation.addNode(node));
                replaced = true;
            } else {
                ops.add(op);
            }
        }
        if (!replaced) {
            ops.add(PatchOperation.addNode(node));
        }
        return withOperations(ops);
    }

    public TranslationState withLeadingNode(ProcessNode node) {
        var ops = new ArrayList<PatchOperation>(operations.size() + 1);
        ops.add(PatchOperation.addNode(node));
        ops.addAll(operations);
        return withOperations(ops);
    }

    /**
     * Appends an {@code add_edge}, or rewrites the pending one with the same id.
     */
    public TranslationState withEdge(ProcessEdge edge) {
        var ops = new ArrayList<PatchOperation>(operations.size() + 1);
        boolean replaced = false;
        for (PatchOperation op : operations) {
            if (op instanceof PatchOperation.AddEdge add && add.edge().getId().equals(edge.getId())) {
                ops.add(PatchOperation.addEdge(edge));
                replaced = true;
            } else {
                ops.add(op);
            }
        }
        if (!replaced) {
            ops.add(PatchOperation.addEdge(edge));
        }
        return withOperations(ops);
    }

    public TranslationState withoutPendingEdge(String edgeId) {
        return withOperations(operations.stream()
                .filter(op -> !(op instanceof PatchOperation.AddEdge add && add.edge().getId().equals(edgeId)))
                .toList());
    }

    /**
     * Queues deletion of an existing edge, once.
     */
    public TranslationState withDeletedEdge(String edgeId) {
        if (deletedEdgeIds().contains(edgeId)) {
            return this;
        }
        var ops = new ArrayList<>(operations);
        ops.add(PatchOperation.deleteEdge(edgeId));
        return withOperations(ops);
    }

    /**
     * Pending nodes keyed by id, in proposal order.
     */
    public Map<String, ProcessNode> pendingNodesById() {
        var byId = new LinkedHashMap<String, ProcessNode>();
        pendingNodes().forEach(node -> byId.put(node.getId(), node));
        return byId;
    }
}
