package com.flow.mapper.service.api.dto;

import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.translate.ProcessIntent;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to translate an intent, optionally against a graph snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslateIntentRequest {

    @NotNull(message = "intent is required")
    private ProcessIntent intent;

    /**
     * Graph to extend; omitted for a new process. Ignored when the intent is
     * applied to a stored flow.
     */
    private ProcessFlow existing;
}
