package com.flow.mapper.service.patch;

import com.flow.mapper.service.labeling.SequentialLabeler;
import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.PatchOperation;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.topology.TopologyValidator;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a patch to a graph snapshot without keeping any state between calls.
 *
 * Operations run in order against a scratch copy. When one of them is
 * impossible a {@link PatchApplicationException} is thrown and the scratch
 * copy is dropped, so the caller's graph is never touched. After the last
 * operation MERGE nodes are inserted where needed and the result is validated.
 */
public class PatchApplier {

    private final TopologyValidator validator;
    private final SequentialLabeler labeler;
    private final MergeNodeInserter mergeInserter;
    private final Clock clock;
    private final FlowEventListener listener;

    public PatchApplier(TopologyValidator validator, SequentialLabeler labeler,
                        IdGenerator idGenerator, Clock clock, FlowEventListener listener) {
        this.validator = validator;
        this.labeler = labeler;
        this.mergeInserter = new MergeNodeInserter(idGenerator);
        this.clock = clock;
        this.listener = listener;
    }

    public PatchResult apply(ProcessFlow flow, FlowPatch patch) {
        return apply(flow, patch, listener);
    }

    /**
     * Same as {@link #apply} without reporting inserted merges.
     */
    public PatchResult dryRun(ProcessFlow flow, FlowPatch patch) {
        return apply(flow, patch, FlowEventListener.NOOP);
    }

    private PatchResult apply(ProcessFlow flow, FlowPatch patch, FlowEventListener events) {
        Instant now = clock.instant();
        var scratch = MutableFlow.copyOf(flow);

        var operations = patch.operations();
        for (int index = 0; index < operations.size(); index++) {
            operations.get(index).accept(new OperationApplier(scratch, now, index));
        }

        int merges = mergeInserter.insertMerges(scratch, now, events);
        var result = scratch.snapshot(now);
        return new PatchResult(result, patch.withAppliedAt(now), validator.validate(result), merges);
    }

    // ==================== Operations ====================

    private final class OperationApplier implements PatchOperation.Visitor<Void> {

        private final MutableFlow flow;
        private final Instant now;
        private final int index;

        private OperationApplier(MutableFlow flow, Instant now, int index) {
            this.flow = flow;
            this.now = now;
            this.index = index;
        }

        @Override
        public Void addNode(PatchOperation.AddNode operation) {
            var node = operation.node();
            requireId(node.getId(), operation);
            if (flow.containsNode(node.getId())) {
                throw fail(operation, "node '" + node.getId() + "' already exists");
            }

            var created = node.getCreatedAt() != null ? node.getCreatedAt() : now;
            var prepared = node.toBuilder()
                    .createdAt(created)
                    .updatedAt(node.getUpdatedAt() != null ? node.getUpdatedAt() : created);
            if (node.is(NodeType.PROCESS) && node.getLogicalId() == null) {
                prepared.logicalId(labeler.nextProvisionalId(flow.nodes()));
            }
            flow.putNode(prepared.build());
            return null;
        }

        @Override
        public Void updateNode(PatchOperation.UpdateNode operation) {
            var node = operation.node();
            var existing = flow.node(node.getId());
            if (existing == null) {
                throw fail(operation, "node '" + node.getId() + "' not found");
            }

            flow.putNode(node.toBuilder()
                    .logicalId(node.getLogicalId() != null ? node.getLogicalId() : existing.getLogicalId())
                    .createdAt(existing.getCreatedAt())
                    .updatedAt(now)
                    .build());
            return null;
        }

        @Override
        public Void deleteNode(PatchOperation.DeleteNode operation) {
            if (!flow.containsNode(operation.nodeId())) {
                throw fail(operation, "node '" + operation.nodeId() + "' not found");
            }
            flow.removeNode(operation.nodeId());
            return null;
        }

        @Override
        public Void addEdge(PatchOperation.AddEdge operation) {
            var edge = operation.edge();
            requireId(edge.getId(), operation);
            if (flow.containsEdge(edge.getId())) {
                throw fail(operation, "edge '" + edge.getId() + "' already exists");
            }

            var source = requireEndpoint(edge.getSource(), "source", operation);
            var target = requireEndpoint(edge.getTarget(), "target", operation);
            if (flow.containsPair(source.getId(), target.getId())) {
                throw fail(operation, "an edge from '" + source.getId() + "' to '" + target.getId() + "' already exists");
            }

            var problem = ConnectionRules.check(flow, source, target);
            if (problem.isPresent()) {
                throw fail(operation, problem.get());
            }

            var created = edge.getCreatedAt() != null ? edge.getCreatedAt() : now;
            flow.addEdge(edge.toBuilder()
                    .createdAt(created)
                    .updatedAt(edge.getUpdatedAt() != null ? edge.getUpdatedAt() : created)
                    .build());
            return null;
        }

        @Override
        public Void updateEdge(PatchOperation.UpdateEdge operation) {
            var edge = operation.edge();
            var existing = flow.edge(edge.getId());
            if (existing == null) {
                throw fail(operation, "edge '" + edge.getId() + "' not found");
            }
            var source = requireEndpoint(edge.getSource(), "source", operation);
            var target = requireEndpoint(edge.getTarget(), "target", operation);

            if (!existing.connects(source.getId(), target.getId())) {
                if (flow.containsPair(source.getId(), target.getId(), edge.getId())) {
                    throw fail(operation, "an edge from '" + source.getId() + "' to '" + target.getId() + "' already exists");
                }
                var problem = ConnectionRules.check(flow, source, target, edge.getId());
                if (problem.isPresent()) {
                    throw fail(operation, problem.get());
                }
            }

            flow.replaceEdge(edge.toBuilder()
                    .createdAt(existing.getCreatedAt())
                    .updatedAt(now)
                    .build());
            return null;
        }

        @Override
        public Void deleteEdge(PatchOperation.DeleteEdge operation) {
            if (!flow.containsEdge(operation.edgeId())) {
                throw fail(operation, "edge '" + operation.edgeId() + "' not found");
            }
            flow.removeEdge(operation.edgeId());
            return null;
        }

        // ==================== Helpers ====================

        private void requireId(String id, PatchOperation operation) {
            if (id == null || id.isBlank()) {
                throw fail(operation, "id is required");
            }
        }

        private ProcessNode requireEndpoint(String nodeId, String side, PatchOperation operation) {
            var node = nodeId != null ? flow.node(nodeId) : null;
            if (node == null) {
                throw fail(operation, side + " node '" + nodeId + "' not found");
            }
            return node;
        }

        private PatchApplicationException fail(PatchOperation operation, String message) {
            return new PatchApplicationException(message, index, operation.type());
        }
    }
}
