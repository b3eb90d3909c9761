package com.flow.mapper.service.engine;

import com.flow.mapper.service.config.FlowConfig;
import com.flow.mapper.service.config.MetricsConfig;
import com.flow.mapper.service.engine.FlowStore.FlowEntry;
import com.flow.mapper.service.labeling.SequentialLabeler;
import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.patch.PatchApplier;
import com.flow.mapper.service.patch.PatchEngine;
import com.flow.mapper.service.patch.PatchHistory;
import com.flow.mapper.service.patch.PatchResult;
import com.flow.mapper.service.topology.TopologyValidator;
import com.flow.mapper.service.topology.TopologyViolation;
import com.flow.mapper.service.translate.IntentTranslator;
import com.flow.mapper.service.translate.ProcessIntent;
import com.flow.mapper.service.translate.Translation;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Coordinates edits of stored flows.
 *
 * Every flow gets its own patch engine (and so its own undo history) and its
 * own lock; writers of one flow are serialized, writers of different flows
 * run in parallel. Readers go straight to the store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowEditingService {

    private final FlowStore flowStore;
    private final PatchApplier patchApplier;
    private final TopologyValidator topologyValidator;
    private final SequentialLabeler sequentialLabeler;
    private final IntentTranslator intentTranslator;
    private final FlowEventListener eventListener;
    private final MetricsConfig metricsConfig;
    private final FlowConfig flowConfig;

    private final Map<String, FlowSession> sessions = new ConcurrentHashMap<>();

    // ==================== Flows ====================

    /**
     * @throws IllegalArgumentException when the seed snapshot is malformed
     */
    public FlowEntry createFlow(String name, ProcessFlow initial) {
        var seed = initial != null ? initial : ProcessFlow.empty();
        requireWellFormed(seed);
        var entry = flowStore.create(name, seed);
        log.info("Flow created: {} ({})", entry.flowId(), name);
        return entry;
    }

    public FlowEntry getFlow(String flowId) {
        return flowStore.findById(flowId)
                .orElseThrow(() -> new FlowNotFoundException(flowId));
    }

    public Collection<FlowEntry> listFlows() {
        return flowStore.findAll();
    }

    public void deleteFlow(String flowId) {
        if (!flowStore.delete(flowId)) {
            throw new FlowNotFoundException(flowId);
        }
        sessions.remove(flowId);
    }

    public List<TopologyViolation> validate(String flowId) {
        return topologyValidator.validate(getFlow(flowId).flow());
    }

    public FlowEntry relabel(String flowId) {
        return withLock(flowId, () -> {
            var current = getFlow(flowId);
            return flowStore.update(flowId, sequentialLabeler.relabel(current.flow()));
        });
    }

    // ==================== Patches ====================

    /**
     * Applies a patch to the current snapshot. On failure the stored flow and
     * its history stay as they were.
     */
    public PatchOutcome applyPatch(String flowId, FlowPatch patch) {
        return withLock(flowId, () -> applyLocked(flowId, patch));
    }

    public PatchResult previewPatch(String flowId, FlowPatch patch) {
        var current = getFlow(flowId);
        return session(flowId).engine().preview(current.flow(), patch);
    }

    /**
     * Restores the snapshot taken before the most recent patch.
     */
    public FlowEntry rollback(String flowId) {
        return withLock(flowId, () -> {
            var previous = session(flowId).engine().rollback()
                    .orElseThrow(() -> new FlowServiceException(
                            "Nothing to roll back for flow " + flowId, flowId, "NOTHING_TO_ROLLBACK"));
            var entry = flowStore.update(flowId, previous);
            log.info("Flow rolled back: {} (revision={})", flowId, entry.revision());
            return entry;
        });
    }

    public List<PatchHistory.HistoryEntry> history(String flowId) {
        getFlow(flowId);
        return session(flowId).engine().history();
    }

    // ==================== Intents ====================

    /**
     * Translates an intent against the flow's current snapshot and applies the result.
     */
    public IntentOutcome applyIntent(String flowId, ProcessIntent intent) {
        return withLock(flowId, () -> {
            var current = getFlow(flowId);
            var translation = translate(intent, current.flow());
            var outcome = applyLocked(flowId, translation.patch());
            return new IntentOutcome(outcome.entry(), translation, outcome.result());
        });
    }

    /**
     * Translates without applying.
     *
     * @param existing graph to translate against, {@code null} for a new graph
     * @throws IllegalArgumentException when {@code existing} is malformed
     */
    public Translation translate(ProcessIntent intent, ProcessFlow existing) {
        if (existing != null) {
            requireWellFormed(existing);
        }
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            return intentTranslator.translate(intent, existing);
        } finally {
            sample.stop(metricsConfig.getTranslateTimer());
        }
    }

    // ==================== Internals ====================

    private static void requireWellFormed(ProcessFlow flow) {
        var problems = flow.integrityProblems();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Malformed flow snapshot: " + String.join("; ", problems));
        }
    }

    private PatchOutcome applyLocked(String flowId, FlowPatch patch) {
        var current = getFlow(flowId);
        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            var result = session(flowId).engine().apply(current.flow(), patch);
            var updated = flowConfig.getFeatures().isRelabelOnApply()
                    ? sequentialLabeler.relabel(result.flow())
                    : result.flow();
            var entry = flowStore.update(flowId, updated);
            log.info("Patch applied to flow {}: {} operations, {} merges, {} warnings (revision={})",
                    flowId, patch.size(), result.mergesInserted(), result.violations().size(), entry.revision());
            return new PatchOutcome(entry, result);
        } finally {
            sample.stop(metricsConfig.getPatchTimer());
        }
    }

    private <T> T withLock(String flowId, Supplier<T> action) {
        if (!flowStore.exists(flowId)) {
            throw new FlowNotFoundException(flowId);
        }
        var lock = session(flowId).lock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private FlowSession session(String flowId) {
        return sessions.computeIfAbsent(flowId, id -> new FlowSession(
                new ReentrantLock(),
                new PatchEngine(patchApplier, new PatchHistory(flowConfig.getHistory().getCapacity()), eventListener)));
    }

    // ==================== Inner Types ====================

    private record FlowSession(ReentrantLock lock, PatchEngine engine) {}

    public record PatchOutcome(FlowEntry entry, PatchResult result) {}

    public record IntentOutcome(FlowEntry entry, Translation translation, PatchResult result) {}
}
