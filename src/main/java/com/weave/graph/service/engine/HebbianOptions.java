package com.weave.graph.service.engine;

import lombok.With;

/**
 * Tuning for {@link HebbianWeightEngine}.
 */
@With
public record HebbianOptions(
        double hebbianStrength,
        double decayRate,
        double pruneThreshold,
        double maxWeight
) {

    public static final double DEFAULT_STRENGTH = 0.1;
    public static final double DEFAULT_DECAY_RATE = 0.99;
    public static final double DEFAULT_PRUNE_THRESHOLD = 0.05;
    public static final double DEFAULT_MAX_WEIGHT = 5.0;

    public HebbianOptions {
        if (hebbianStrength < 0) {
            throw new IllegalArgumentException("hebbianStrength must be non-negative: " + hebbianStrength);
        }
        if (decayRate < 0 || decayRate > 1) {
            throw new IllegalArgumentException("decayRate must be in [0, 1]: " + decayRate);
        }
    }

    public static HebbianOptions defaults() {
        return new HebbianOptions(DEFAULT_STRENGTH, DEFAULT_DECAY_RATE,
                DEFAULT_PRUNE_THRESHOLD, DEFAULT_MAX_WEIGHT);
    }
}
