package com.flow.mapper.service.observability;

import com.flow.mapper.service.config.MetricsConfig;
import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.topology.TopologyViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns core events into log lines and Micrometer metrics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingFlowEventListener implements FlowEventListener {

    private final MetricsConfig metricsConfig;

    // ==================== Patch Engine ====================

    @Override
    public void onPatchApplied(FlowPatch patch, List<TopologyViolation> remainingViolations) {
        metricsConfig.getPatchesApplied().increment();
        log.debug("Patch applied: source={}, operations={}", patch.source(), patch.size());
        logViolations("Patch left topology warnings", remainingViolations);
    }

    @Override
    public void onPatchRejected(FlowPatch patch, int operationIndex, String reason) {
        metricsConfig.getPatchesRejected().increment();
        log.warn("Patch rejected: source={}, operation={}, reason={}", patch.source(), operationIndex, reason);
    }

    @Override
    public void onMergeInserted(String targetNodeId, String mergeNodeId, int redirectedEdges) {
        metricsConfig.getMergesInserted().increment();
        log.debug("Inserted merge {} before {} ({} edges redirected)", mergeNodeId, targetNodeId, redirectedEdges);
    }

    // ==================== Intent Translator ====================

    @Override
    public void onTranslationStage(String stage, int pendingOperations) {
        log.debug("Translation stage {} done: {} pending operations", stage, pendingOperations);
    }

    @Override
    public void onTranslationRepair(int attempt, List<TopologyViolation> violations, int repairOperations) {
        metricsConfig.getTranslationRepairs().increment();
        log.info("Repair round {}: {} violations, {} repair operations", attempt, violations.size(), repairOperations);
    }

    @Override
    public void onTranslationCompleted(FlowPatch patch, boolean incremental, List<TopologyViolation> remainingViolations) {
        metricsConfig.getTranslations().increment();
        log.info("Intent translated: mode={}, source={}, operations={}",
                incremental ? "incremental" : "fresh", patch.source(), patch.size());
        logViolations("Translation left topology warnings", remainingViolations);
    }

    @Override
    public void onTranslationRejected(String reason, String message) {
        metricsConfig.getTranslationsRejected().increment();
        log.warn("Intent rejected: reason={}, message={}", reason, message);
    }

    @Override
    public void onOperationDropped(int operationIndex, String reason) {
        log.warn("Dropped translated operation {}: {}", operationIndex, reason);
    }

    @Override
    public void onFlowSkipped(String fromStep, String toStep, String reason) {
        log.debug("Skipped flow {} -> {}: {}", fromStep, toStep, reason);
    }

    private void logViolations(String prefix, List<TopologyViolation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        log.warn("{}: {}", prefix, violations.size());
        violations.forEach(violation -> log.warn("  - {}", violation.message()));
    }
}
