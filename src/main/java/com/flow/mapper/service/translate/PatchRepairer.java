package com.flow.mapper.service.translate;

import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.PatchOperation;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.patch.PatchApplicationException;
import com.flow.mapper.service.patch.PatchApplier;
import com.flow.mapper.service.patch.PatchResult;
import com.flow.mapper.service.topology.TopologyRules;
import com.flow.mapper.service.topology.TopologyViolation;
import com.flow.mapper.service.topology.TopologyViolation.Direction;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded validate-and-repair loop over a translated patch.
 *
 * Each round dry-runs the operations against the target graph, reads the
 * remaining violations and appends mechanical fixes for the ones it knows:
 * a START with nothing after it, a PROCESS or DECISION nothing leads to, and
 * a DECISION with fewer than two branches.
 */
final class PatchRepairer {

    static final String END_LABEL = "End process";
    static final String ELSE_CONDITION = "else";

    private final PatchApplier scratchApplier;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final FlowEventListener listener;
    private final int maxAttempts;

    PatchRepairer(PatchApplier scratchApplier, IdGenerator idGenerator, Clock clock,
                  FlowEventListener listener, int maxAttempts) {
        this.scratchApplier = scratchApplier;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.listener = listener;
        this.maxAttempts = maxAttempts;
    }

    Outcome repair(ProcessFlow existing, List<PatchOperation> operations) {
        var run = dryRun(existing, OperationOrdering.canonical(operations));
        int rounds = 0;

        for (int attempt = 1; attempt <= maxAttempts && !run.result().isValid(); attempt++) {
            var violations = run.result().violations();
            var fixes = fixesFor(run.result().flow(), violations);
            if (fixes.isEmpty()) {
                break;
            }

            var combined = new ArrayList<>(run.operations());
            combined.addAll(fixes);
            listener.onTranslationRepair(attempt, violations, fixes.size());
            rounds++;
            run = dryRun(existing, OperationOrdering.canonical(combined));
        }

        return new Outcome(run.operations(), run.result(), rounds);
    }

    // ==================== Dry Run ====================

    /**
     * Applies the operations to a scratch copy, leaving out any operation the
     * engine refuses. Terminates because every retry has one operation fewer.
     */
    private DryRun dryRun(ProcessFlow existing, List<PatchOperation> operations) {
        var remaining = new ArrayList<>(operations);
        while (true) {
            try {
                var patch = FlowPatch.of(IntentTranslator.SOURCE, clock.instant(), remaining);
                return new DryRun(List.copyOf(remaining), scratchApplier.apply(existing, patch));
            } catch (PatchApplicationException e) {
                listener.onOperationDropped(e.getOperationIndex(), e.getMessage());
                remaining.remove(e.getOperationIndex());
            }
        }
    }

    // ==================== Fixes ====================

    private List<PatchOperation> fixesFor(ProcessFlow flow, List<TopologyViolation> violations) {
        var fixes = new ArrayList<PatchOperation>();
        Set<String> usedSources = new HashSet<>();
        Set<String> connectedTargets = new HashSet<>();

        for (TopologyViolation violation : violations) {
            if (violation.concerns(NodeType.START, Direction.OUTGOING) && violation.isBelowMinimum()) {
                connectStart(flow, violation.elementId(), usedSources, connectedTargets, fixes);
            }
        }
        for (TopologyViolation violation : violations) {
            boolean orphan = violation.concerns(NodeType.PROCESS, Direction.INCOMING)
                    || violation.concerns(NodeType.DECISION, Direction.INCOMING);
            if (orphan && violation.isBelowMinimum() && !connectedTargets.contains(violation.elementId())) {
                connectOrphan(flow, violation.elementId(), usedSources, fixes);
                connectedTargets.add(violation.elementId());
            }
        }
        for (TopologyViolation violation : violations) {
            if (violation.concerns(NodeType.DECISION, Direction.OUTGOING) && violation.isBelowMinimum()) {
                addElseBranches(violation.elementId(), violation.expected().min() - violation.actual(), fixes);
            }
        }
        return fixes;
    }

    private void connectStart(ProcessFlow flow, String startId, Set<String> usedSources,
                              Set<String> connectedTargets, List<PatchOperation> fixes) {
        var target = flow.nodes().stream()
                .filter(node -> node.is(NodeType.PROCESS) || node.is(NodeType.DECISION) || node.is(NodeType.MERGE))
                .filter(node -> flow.incomingCount(node.getId()) == 0)
                .filter(node -> !connectedTargets.contains(node.getId()))
                .findFirst();
        if (target.isEmpty()) {
            return;
        }
        fixes.add(PatchOperation.addEdge(edge(startId, target.get().getId(), null)));
        usedSources.add(startId);
        connectedTargets.add(target.get().getId());
    }

    private void connectOrphan(ProcessFlow flow, String orphanId, Set<String> usedSources, List<PatchOperation> fixes) {
        var start = flow.nodesOfType(NodeType.START).stream().findFirst();
        if (start.isPresent() && flow.outgoingCount(start.get().getId()) == 0
                && !usedSources.contains(start.get().getId())) {
            fixes.add(PatchOperation.addEdge(edge(start.get().getId(), orphanId, null)));
            usedSources.add(start.get().getId());
            return;
        }

        var anchor = lastDeadEnd(flow, orphanId, usedSources);
        if (anchor.isPresent()) {
            fixes.add(PatchOperation.addEdge(edge(anchor.get().getId(), orphanId, null)));
            usedSources.add(anchor.get().getId());
        }
    }

    /**
     * Most recent PROCESS without outgoing edges that is not reachable from the
     * orphan, so the new edge cannot close a cycle through it.
     */
    private Optional<ProcessNode> lastDeadEnd(ProcessFlow flow, String orphanId, Set<String> usedSources) {
        var downstream = reachableFrom(flow, orphanId);
        var processes = flow.nodesOfType(NodeType.PROCESS);
        for (int i = processes.size() - 1; i >= 0; i--) {
            var candidate = processes.get(i);
            if (flow.outgoingCount(candidate.getId()) == 0
                    && !downstream.contains(candidate.getId())
                    && !usedSources.contains(candidate.getId())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private void addElseBranches(String decisionId, long missing, List<PatchOperation> fixes) {
        for (long i = 0; i < Math.min(missing, TopologyRules.MIN_DECISION_BRANCHES); i++) {
            var end = ProcessNode.builder()
                    .id(idGenerator.nextId())
                    .type(NodeType.END)
                    .label(END_LABEL)
                    .build();
            fixes.add(PatchOperation.addNode(end));
            fixes.add(PatchOperation.addEdge(edge(decisionId, end.getId(), ELSE_CONDITION)));
        }
    }

    private ProcessEdge edge(String source, String target, String condition) {
        return ProcessEdge.builder()
                .id(idGenerator.nextId())
                .source(source)
                .target(target)
                .condition(condition)
                .build();
    }

    /**
     * Nodes reachable from {@code nodeId}, the node itself included.
     */
    static Set<String> reachableFrom(ProcessFlow flow, String nodeId) {
        Set<String> visited = new HashSet<>();
        var queue = new ArrayDeque<String>();
        visited.add(nodeId);
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (ProcessEdge edge : flow.outgoingEdges(current)) {
                if (visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return visited;
    }

    // ==================== Results ====================

    record Outcome(List<PatchOperation> operations, PatchResult preview, int repairRounds) {
    }

    private record DryRun(List<PatchOperation> operations, PatchResult result) {
    }
}
