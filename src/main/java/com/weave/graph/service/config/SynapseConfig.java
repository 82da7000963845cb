package com.weave.graph.service.config;

import com.weave.graph.service.engine.LinkerOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for retroactive synaptic linking.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.synapse")
public class SynapseConfig {

    /**
     * Minimum similarity for a link to be created (0..1).
     */
    private double threshold = LinkerOptions.DEFAULT_THRESHOLD;

    /**
     * Maximum number of links created per inserted node.
     */
    private int maxConnections = LinkerOptions.DEFAULT_MAX_CONNECTIONS;

    public LinkerOptions toOptions() {
        return new LinkerOptions(threshold, maxConnections);
    }
}
