package com.flow.mapper.service.api.dto;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.PatchOperation;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request to apply (or preview) an ordered list of operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchRequest {

    @NotEmpty(message = "operations are required")
    private List<PatchOperation> operations;

    /**
     * Provenance tag; "api" when absent.
     */
    private String source;

    public FlowPatch toPatch(Instant createdAt) {
        return FlowPatch.of(source, createdAt, operations);
    }
}
