package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.observability.FlowEventListener;

import java.util.List;
import java.util.Optional;

/**
 * Applies patches and keeps a bounded undo history.
 *
 * Not thread-safe: callers serialize writers per graph.
 */
public class PatchEngine {

    private final PatchApplier applier;
    private final PatchHistory history;
    private final FlowEventListener listener;

    public PatchEngine(PatchApplier applier, PatchHistory history, FlowEventListener listener) {
        this.applier = applier;
        this.history = history;
        this.listener = listener;
    }

    /**
     * Applies the patch to a copy of {@code flow} and records the pre-patch
     * snapshot for rollback.
     *
     * @throws PatchApplicationException when an operation is impossible; history is left untouched
     */
    public PatchResult apply(ProcessFlow flow, FlowPatch patch) {
        PatchResult result;
        try {
            result = applier.apply(flow, patch);
        } catch (PatchApplicationException e) {
            listener.onPatchRejected(patch, e.getOperationIndex(), e.getMessage());
            throw e;
        }
        history.record(flow, result.patch());
        listener.onPatchApplied(result.patch(), result.violations());
        return result;
    }

    /**
     * Same as {@link #apply} without recording history or reporting events.
     */
    public PatchResult preview(ProcessFlow flow, FlowPatch patch) {
        return applier.dryRun(flow, patch);
    }

    /**
     * Single-step undo.
     *
     * @return the snapshot before the most recent patch
     */
    public Optional<ProcessFlow> rollback() {
        return history.pop();
    }

    public List<PatchHistory.HistoryEntry> history() {
        return history.entries();
    }

    public int historySize() {
        return history.size();
    }
}
