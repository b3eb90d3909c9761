package com.flow.mapper.service.translate;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.topology.TopologyViolation;

import java.util.List;

/**
 * Result of translating an intent.
 *
 * @param patch               the patch to hand to the patch engine
 * @param preview             graph the patch produces on the graph it was translated against
 * @param remainingViolations violations the repair loop could not fix
 * @param incremental         whether the intent extended an existing graph
 * @param repairRounds        repair rounds that added operations
 */
public record Translation(
        FlowPatch patch,
        ProcessFlow preview,
        List<TopologyViolation> remainingViolations,
        boolean incremental,
        int repairRounds
) {

    public Translation {
        remainingViolations = List.copyOf(remainingViolations);
    }

    public boolean isValid() {
        return remainingViolations.isEmpty();
    }

    public boolean isRepaired() {
        return repairRounds > 0;
    }
}
