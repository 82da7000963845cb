package com.weave.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for Weave Graph Service.
 *
 * Contains the feature flags that switch engine behaviours on or off.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave")
public class WeaveConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Link every inserted node to similar historical nodes.
         */
        private boolean synapticLinkingEnabled = true;

        /**
         * Strengthen edges between co-retrieved nodes on queries.
         */
        private boolean hebbianEnabled = true;

        /**
         * Score links with an external embedding service instead of keywords.
         * Requires weave.embedding.* to be configured.
         */
        private boolean embeddingLinkingEnabled = false;

        /**
         * Persist the session snapshot after every mutating operation.
         */
        private boolean autoSave = true;

        /**
         * Enable metrics collection.
         */
        private boolean metricsEnabled = true;
    }
}
