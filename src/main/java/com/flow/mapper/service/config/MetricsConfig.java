package com.flow.mapper.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Flow Mapper Service.
 *
 * Provides custom metrics for patch application and intent translation.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter patchesApplied;
    private final Counter patchesRejected;
    private final Counter mergesInserted;
    private final Counter translations;
    private final Counter translationsRejected;
    private final Counter translationRepairs;

    // Timers
    private final Timer patchTimer;
    private final Timer translateTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.patchesApplied = Counter.builder("flow.patch.applied.count")
                .description("Number of patches applied")
                .register(registry);

        this.patchesRejected = Counter.builder("flow.patch.rejected.count")
                .description("Number of patches rejected by the patch engine")
                .register(registry);

        this.mergesInserted = Counter.builder("flow.merge.inserted.count")
                .description("Number of MERGE nodes inserted by post-processing")
                .register(registry);

        this.translations = Counter.builder("flow.translate.count")
                .description("Number of intents translated")
                .register(registry);

        this.translationsRejected = Counter.builder("flow.translate.rejected.count")
                .description("Number of intents rejected")
                .register(registry);

        this.translationRepairs = Counter.builder("flow.translate.repair.count")
                .description("Number of repair rounds run by the translator")
                .register(registry);

        this.patchTimer = Timer.builder("flow.patch.duration")
                .description("Time taken to apply a patch")
                .register(registry);

        this.translateTimer = Timer.builder("flow.translate.duration")
                .description("Time taken to translate an intent")
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
