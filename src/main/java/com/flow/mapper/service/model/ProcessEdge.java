package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Directed connection between two nodes of the same graph.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessEdge {

    String id;

    String source;

    String target;

    /**
     * Branch label on edges leaving a DECISION node.
     */
    String condition;

    Instant createdAt;

    Instant updatedAt;

    public boolean connects(String sourceId, String targetId) {
        return source.equals(sourceId) && target.equals(targetId);
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }
}
