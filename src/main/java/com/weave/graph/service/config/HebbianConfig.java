package com.weave.graph.service.config;

import com.weave.graph.service.engine.HebbianOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Hebbian edge weighting and its maintenance cycle.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.hebbian")
public class HebbianConfig {

    /**
     * Weight added to an edge each time its endpoints are retrieved together.
     */
    private double strength = HebbianOptions.DEFAULT_STRENGTH;

    /**
     * Multiplier applied to every edge weight per maintenance cycle.
     */
    private double decayRate = HebbianOptions.DEFAULT_DECAY_RATE;

    /**
     * Edges strictly below this weight are deleted when pruning.
     */
    private double pruneThreshold = HebbianOptions.DEFAULT_PRUNE_THRESHOLD;

    /**
     * Ceiling for strengthened weights.
     */
    private double maxWeight = HebbianOptions.DEFAULT_MAX_WEIGHT;

    /**
     * Interval between decay-and-prune cycles in milliseconds.
     */
    private long cycleIntervalMs = 300000; // 5 minutes

    public HebbianOptions toOptions() {
        return new HebbianOptions(strength, decayRate, pruneThreshold, maxWeight);
    }
}
