package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A step, branch point, convergence point or terminal of a process graph.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessNode {

    String id;

    @Builder.Default
    NodeType type = NodeType.PROCESS;

    String label;

    /**
     * Who performs the step.
     */
    String owner;

    /**
     * Tool or system used by the step.
     */
    String system;

    @Builder.Default
    AutomationLevel automation = AutomationLevel.MANUAL;

    /**
     * Hierarchical sequence label, e.g. {@code 1.1.1.4}.
     */
    String logicalId;

    boolean userModified;

    Instant createdAt;

    Instant updatedAt;

    public boolean is(NodeType candidate) {
        return type == candidate;
    }
}
