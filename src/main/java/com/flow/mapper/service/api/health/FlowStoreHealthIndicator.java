package com.flow.mapper.service.api.health;

import com.flow.mapper.service.config.FlowConfig;
import com.flow.mapper.service.engine.FlowStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the in-memory flow store.
 *
 * Reports store usage; DOWN once no more flows can be created.
 */
@Component
@RequiredArgsConstructor
public class FlowStoreHealthIndicator implements HealthIndicator {

    private final FlowStore flowStore;
    private final FlowConfig config;

    @Override
    public Health health() {
        int count = flowStore.count();
        int capacity = config.getStore().getMaxFlows();
        int utilization = capacity == 0 ? 100 : (int) ((count * 100L) / capacity);

        Health.Builder builder = count >= capacity
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("flowCount", count)
                .withDetail("flowCapacity", capacity)
                .withDetail("utilizationPercent", utilization)
                .withDetail("historyCapacity", config.getHistory().getCapacity())
                .build();
    }
}
