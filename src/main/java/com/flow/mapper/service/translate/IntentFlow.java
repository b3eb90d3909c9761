package com.flow.mapper.service.translate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * "Step B follows step A", optionally under a condition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentFlow(
        @JsonAlias("from_step") String fromStep,
        @JsonAlias("to_step") String toStep,
        String condition
) {

    public static IntentFlow of(String fromStep, String toStep) {
        return new IntentFlow(fromStep, toStep, null);
    }

    @JsonIgnore
    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }
}
