package com.flow.mapper.service.translate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One step of a process as described by a person, without any topology concerns.
 *
 * @param id         intent-local step id referenced by {@link IntentFlow}
 * @param text       what happens
 * @param stepType   semantic tag, {@link IntentStepType#STEP} when absent
 * @param who        performer, becomes the node owner
 * @param tool       system used, becomes the node system
 * @param manualAuto "manual" or "automated"
 * @param options    branch options mentioned for a decision step
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentStep(
        String id,
        String text,
        @JsonAlias("step_type") IntentStepType stepType,
        String who,
        String tool,
        @JsonAlias("manual_auto") String manualAuto,
        List<String> options
) {

    public IntentStep {
        stepType = stepType == null ? IntentStepType.STEP : stepType;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static IntentStep of(String id, String text) {
        return new IntentStep(id, text, IntentStepType.STEP, null, null, null, null);
    }

    public static IntentStep of(String id, String text, IntentStepType stepType) {
        return new IntentStep(id, text, stepType, null, null, null, null);
    }
}
