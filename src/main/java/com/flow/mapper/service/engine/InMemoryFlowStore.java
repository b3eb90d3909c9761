package com.flow.mapper.service.engine;

import com.flow.mapper.service.config.FlowConfig;
import com.flow.mapper.service.config.MetricsConfig;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.ProcessFlow;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of FlowStore.
 * Thread-safe; readers always see a complete snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryFlowStore implements FlowStore {

    private final MetricsConfig metricsConfig;
    private final FlowConfig flowConfig;
    private final IdGenerator idGenerator;
    private final Clock flowClock;

    private final Map<String, FlowEntry> flows = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        registerMetrics();
        log.info("InMemoryFlowStore initialized, max flows: {}", maxFlows());
    }

    private void registerMetrics() {
        metricsConfig.registerStoreGauge(
                "flow.store.flows.count",
                "Number of flows in memory",
                this::count
        );
    }

    // ==================== FlowStore Interface ====================

    @Override
    public FlowEntry create(String name, ProcessFlow flow) {
        if (flows.size() >= maxFlows()) {
            throw new FlowServiceException(
                    "Flow store is full (" + maxFlows() + " flows)", null, "STORE_FULL");
        }

        var now = flowClock.instant();
        var flowId = idGenerator.nextId();
        var entry = new FlowEntry(flowId, name, stamp(flow, now), 0, now, now);
        flows.put(flowId, entry);

        log.info("Flow stored: {} (nodes={}, edges={})",
                flowId, flow.nodes().size(), flow.edges().size());
        return entry;
    }

    @Override
    public Optional<FlowEntry> findById(String flowId) {
        return Optional.ofNullable(flows.get(flowId));
    }

    @Override
    public Collection<FlowEntry> findAll() {
        return List.copyOf(flows.values());
    }

    @Override
    public boolean exists(String flowId) {
        return flows.containsKey(flowId);
    }

    @Override
    public boolean delete(String flowId) {
        var removed = flows.remove(flowId);
        if (removed != null) {
            log.info("Flow deleted: {}", flowId);
            return true;
        }
        return false;
    }

    @Override
    public int count() {
        return flows.size();
    }

    @Override
    public FlowEntry update(String flowId, ProcessFlow flow) {
        var updated = flows.computeIfPresent(flowId, (id, existing) -> new FlowEntry(
                id,
                existing.name(),
                flow,
                existing.revision() + 1,
                existing.createdAt(),
                flowClock.instant()));
        if (updated == null) {
            throw new FlowNotFoundException(flowId);
        }
        log.debug("Flow updated: {} (revision={})", flowId, updated.revision());
        return updated;
    }

    // ==================== Utility Methods ====================

    private ProcessFlow stamp(ProcessFlow flow, Instant now) {
        var createdAt = flow.createdAt() != null ? flow.createdAt() : now;
        return new ProcessFlow(flow.nodes(), flow.edges(), createdAt,
                flow.updatedAt() != null ? flow.updatedAt() : createdAt);
    }

    private int maxFlows() {
        return flowConfig.getStore().getMaxFlows();
    }
}
