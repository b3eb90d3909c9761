package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * A single graph mutation. The set of operation kinds is closed: every
 * consumer goes through {@link Visitor}, so a new kind cannot be silently
 * skipped.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PatchOperation.AddNode.class, name = "add_node"),
        @JsonSubTypes.Type(value = PatchOperation.UpdateNode.class, name = "update_node"),
        @JsonSubTypes.Type(value = PatchOperation.DeleteNode.class, name = "delete_node"),
        @JsonSubTypes.Type(value = PatchOperation.AddEdge.class, name = "add_edge"),
        @JsonSubTypes.Type(value = PatchOperation.UpdateEdge.class, name = "update_edge"),
        @JsonSubTypes.Type(value = PatchOperation.DeleteEdge.class, name = "delete_edge")
})
public sealed interface PatchOperation {

    <R> R accept(Visitor<R> visitor);

    @JsonIgnore
    OperationType type();

    static PatchOperation addNode(ProcessNode node) {
        return new AddNode(node);
    }

    static PatchOperation updateNode(ProcessNode node) {
        return new UpdateNode(node);
    }

    static PatchOperation deleteNode(String nodeId) {
        return new DeleteNode(nodeId);
    }

    static PatchOperation addEdge(ProcessEdge edge) {
        return new AddEdge(edge);
    }

    static PatchOperation updateEdge(ProcessEdge edge) {
        return new UpdateEdge(edge);
    }

    static PatchOperation deleteEdge(String edgeId) {
        return new DeleteEdge(edgeId);
    }

    interface Visitor<R> {
        R addNode(AddNode operation);

        R updateNode(UpdateNode operation);

        R deleteNode(DeleteNode operation);

        R addEdge(AddEdge operation);

        R updateEdge(UpdateEdge operation);

        R deleteEdge(DeleteEdge operation);
    }

    record AddNode(@JsonProperty("node") ProcessNode node) implements PatchOperation {
        public AddNode {
            Objects.requireNonNull(node, "node data required for add_node");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.addNode(this);
        }

        @Override
        public OperationType type() {
            return OperationType.ADD_NODE;
        }
    }

    record UpdateNode(@JsonProperty("node") ProcessNode node) implements PatchOperation {
        public UpdateNode {
            Objects.requireNonNull(node, "node data required for update_node");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.updateNode(this);
        }

        @Override
        public OperationType type() {
            return OperationType.UPDATE_NODE;
        }
    }

    record DeleteNode(@JsonProperty("nodeId") String nodeId) implements PatchOperation {
        public DeleteNode {
            Objects.requireNonNull(nodeId, "node id required for delete_node");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteNode(this);
        }

        @Override
        public OperationType type() {
            return OperationType.DELETE_NODE;
        }
    }

    record AddEdge(@JsonProperty("edge") ProcessEdge edge) implements PatchOperation {
        public AddEdge {
            Objects.requireNonNull(edge, "edge data required for add_edge");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.addEdge(this);
        }

        @Override
        public OperationType type() {
            return OperationType.ADD_EDGE;
        }
    }

    record UpdateEdge(@JsonProperty("edge") ProcessEdge edge) implements PatchOperation {
        public UpdateEdge {
            Objects.requireNonNull(edge, "edge data required for update_edge");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.updateEdge(this);
        }

        @Override
        public OperationType type() {
            return OperationType.UPDATE_EDGE;
        }
    }

    record DeleteEdge(@JsonProperty("edgeId") String edgeId) implements PatchOperation {
        public DeleteEdge {
            Objects.requireNonNull(edgeId, "edge id required for delete_edge");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.deleteEdge(this);
        }

        @Override
        public OperationType type() {
            return OperationType.DELETE_EDGE;
        }
    }
}
