package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * DTO describing the outcome of an applied or previewed patch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchResponse {

    private String flowId;

    /**
     * Revision after the patch; absent for previews.
     */
    private Long revision;

    private String source;

    private int operationCount;

    /**
     * MERGE nodes added by post-processing.
     */
    private int mergesInserted;

    private Instant appliedAt;

    /**
     * Warnings left after the patch; they never block it.
     */
    private List<ViolationResponse> violations;

    private FlowDetailResponse flow;
}
