package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for flow summary responses.
 *
 * Provides a lightweight view of a flow for listing endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowSummaryResponse {

    /**
     * Unique flow identifier.
     */
    private String flowId;

    private String name;

    /**
     * Number of snapshots that replaced the initial one.
     */
    private long revision;

    private int nodeCount;

    private int edgeCount;

    /**
     * Whether the current snapshot satisfies every topology rule.
     */
    private boolean valid;

    private Instant createdAt;

    private Instant lastUpdatedAt;
}
