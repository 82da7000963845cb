package com.weave.graph.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for snapshot persistence.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "weave.persistence")
public class PersistenceConfig {

    /**
     * Storage backend.
     */
    private Provider provider = Provider.JSON;

    /**
     * Root directory for the json provider.
     */
    private String dataDir = "./weave-data";

    public enum Provider {
        JSON,
        MEMORY
    }
}
