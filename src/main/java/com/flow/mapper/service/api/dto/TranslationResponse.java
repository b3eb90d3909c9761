package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for an intent translation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranslationResponse {

    /**
     * "fresh" or "incremental".
     */
    private String mode;

    private FlowPatch patch;

    /**
     * Graph the patch produces.
     */
    private ProcessFlow preview;

    private int repairRounds;

    private List<ViolationResponse> violations;

    /**
     * Set when the translated patch was applied to a stored flow.
     */
    private PatchResponse applied;
}
