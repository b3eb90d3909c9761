package com.flow.mapper.service.translate;

import com.flow.mapper.service.model.OperationType;
import com.flow.mapper.service.model.PatchOperation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Puts translated operations into an order the patch engine can always apply:
 * nodes first, then edge deletions, node deletions, edge additions and edge updates.
 * Relative order within a kind is kept. Repeated deletions and repeated
 * (source, target) pairs are dropped.
 */
final class OperationOrdering {

    private OperationOrdering() {
    }

    static List<PatchOperation> canonical(List<PatchOperation> operations) {
        var sorted = new ArrayList<>(operations);
        sorted.sort(Comparator.comparingInt(operation -> rank(operation.type())));

        Set<String> seen = new HashSet<>();
        var result = new ArrayList<PatchOperation>(sorted.size());
        for (PatchOperation operation : sorted) {
            if (seen.add(identity(operation))) {
                result.add(operation);
            }
        }
        return result;
    }

    private static int rank(OperationType type) {
        return switch (type) {
            case ADD_NODE -> 0;
            case UPDATE_NODE -> 1;
            case DELETE_EDGE -> 2;
            case DELETE_NODE -> 3;
            case ADD_EDGE -> 4;
            case UPDATE_EDGE -> 5;
        };
    }

    private static String identity(PatchOperation operation) {
        return operation.accept(new PatchOperation.Visitor<>() {
            @Override
            public String addNode(PatchOperation.AddNode op) {
                return "add_node:" + op.node().getId();
            }

            @Override
            public String updateNode(PatchOperation.UpdateNode op) {
                return "update_node:" + op.node().getId();
            }

            @Override
            public String deleteNode(PatchOperation.DeleteNode op) {
                return "delete_node:" + op.nodeId();
            }

            @Override
            public String addEdge(PatchOperation.AddEdge op) {
                return "add_edge:" + op.edge().getSource() + "->" + op.edge().getTarget();
            }

            @Override
            public String updateEdge(PatchOperation.UpdateEdge op) {
                return "update_edge:" + op.edge().getId();
            }

            @Override
            public String deleteEdge(PatchOperation.DeleteEdge op) {
                return "delete_edge:" + op.edgeId();
            }
        });
    }
}
