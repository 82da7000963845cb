package com.weave.graph.service.config;

import com.weave.graph.service.engine.CompressionEngine;
import com.weave.graph.service.engine.GraphStore;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for context-size compression.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.compression")
public class CompressionConfig {

    /**
     * Context usage (0..1] at which a session should be compressed.
     */
    private double threshold = GraphStore.DEFAULT_COMPRESSION_THRESHOLD;

    /**
     * Share of nodes archived by one compression run (0..1).
     */
    private double targetReduction = CompressionEngine.DEFAULT_TARGET_REDUCTION;
}
