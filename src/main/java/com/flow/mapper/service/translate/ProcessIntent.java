package com.flow.mapper.service.translate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Semantic description of a process: unordered steps plus the logical order between them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessIntent(
        List<IntentStep> steps,
        List<IntentFlow> flows,
        @JsonAlias("process_name") String processName,
        String description
) {

    public ProcessIntent {
        steps = steps == null ? List.of() : List.copyOf(steps);
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    public static ProcessIntent of(List<IntentStep> steps, List<IntentFlow> flows) {
        return new ProcessIntent(steps, flows, null, null);
    }

    public List<IntentFlow> flowsFrom(String stepId) {
        return flows.stream().filter(flow -> stepId.equals(flow.fromStep())).toList();
    }

    public long incomingFlowCount(String stepId) {
        return flows.stream().filter(flow -> stepId.equals(flow.toStep())).count();
    }

    public boolean hasExplicitStart() {
        return steps.stream().anyMatch(step -> step.stepType() == IntentStepType.START_POINT);
    }
}
