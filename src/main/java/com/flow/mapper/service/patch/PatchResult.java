package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.topology.TopologyViolation;

import java.util.List;

/**
 * Outcome of a successfully applied patch.
 *
 * @param flow           the new graph
 * @param patch          the patch, stamped with its application time
 * @param violations     topology warnings left after merge insertion; never blocking
 * @param mergesInserted MERGE nodes added by post-processing
 */
public record PatchResult(
        ProcessFlow flow,
        FlowPatch patch,
        List<TopologyViolation> violations,
        int mergesInserted
) {

    public PatchResult {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
