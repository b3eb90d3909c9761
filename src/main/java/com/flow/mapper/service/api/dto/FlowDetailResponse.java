package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * DTO for detailed flow responses.
 *
 * Provides the complete graph with nodes, edges and current topology violations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowDetailResponse {

    private String flowId;

    private String name;

    private long revision;

    private Instant createdAt;

    private Instant lastUpdatedAt;

    private List<ProcessNode> nodes;

    private List<ProcessEdge> edges;

    /**
     * Empty when the graph is valid.
     */
    private List<ViolationResponse> violations;
}
