package com.weave.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for in-memory session retention and eviction.
 *
 * Evicted sessions are saved first and reloaded from storage on next use.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.retention")
public class RetentionConfig {

    /**
     * Maximum number of sessions held in memory.
     */
    private int maxSessions = 1000;

    /**
     * Idle time after which a session is evicted from memory (0 = never).
     */
    private long idleTtlMinutes = 30;

    /**
     * Eviction check interval in milliseconds.
     */
    private long evictionIntervalMs = 60000; // 1 minute
}
