package com.weave.graph.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Weave Graph Service.
 *
 * Provides custom metrics for linking, Hebbian maintenance, compression and persistence.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter nodesAdded;
    private final Counter synapsesCreated;
    private final Counter edgesStrengthened;
    private final Counter decayCycles;
    private final Counter edgesPruned;
    private final Counter nodesArchived;
    private final Counter errorsSuppressed;

    // Timers
    private final Timer linkingTimer;
    private final Timer snapshotSaveTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.nodesAdded = Counter.builder("weave.nodes.added.count")
                .description("Number of nodes inserted")
                .register(registry);

        this.synapsesCreated = Counter.builder("weave.synapses.created.count")
                .description("Number of edges created by retroactive linking")
                .register(registry);

        this.edgesStrengthened = Counter.builder("weave.edges.strengthened.count")
                .description("Number of Hebbian strengthen operations")
                .register(registry);

        this.decayCycles = Counter.builder("weave.decay.cycles.count")
                .description("Number of decay-and-prune cycles run")
                .register(registry);

        this.edgesPruned = Counter.builder("weave.edges.pruned.count")
                .description("Number of edges pruned for low weight")
                .register(registry);

        this.nodesArchived = Counter.builder("weave.nodes.archived.count")
                .description("Number of nodes moved to the archive")
                .register(registry);

        this.errorsSuppressed = Counter.builder("weave.errors.suppressed.count")
                .description("Number of ERROR nodes suppressed with a correction")
                .register(registry);

        this.linkingTimer = Timer.builder("weave.linking.duration")
                .description("Time taken for retroactive linking of one node")
                .register(registry);

        this.snapshotSaveTimer = Timer.builder("weave.snapshot.save.duration")
                .description("Time taken to persist a session snapshot")
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
