package com.weave.graph.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weave.graph.service.persistence.GraphPersistenceManager;
import com.weave.graph.service.persistence.InMemoryPersistenceGateway;
import com.weave.graph.service.persistence.JsonFilePersistenceGateway;
import com.weave.graph.service.persistence.PersistenceGateway;
import com.weave.graph.service.persistence.SnapshotCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Configuration for snapshot persistence beans.
 */
@Slf4j
@Configuration
public class StorageConfig {

    /**
     * Storage backend selected by weave.persistence.provider. Closed on shutdown.
     */
    @Bean(destroyMethod = "close")
    public PersistenceGateway persistenceGateway(PersistenceConfig persistenceConfig,
                                                 SnapshotCodec snapshotCodec) {
        return switch (persistenceConfig.getProvider()) {
            case MEMORY -> {
                log.info("Initializing in-memory persistence gateway");
                yield new InMemoryPersistenceGateway();
            }
            case JSON -> {
                log.info("Initializing JSON persistence gateway at {}", persistenceConfig.getDataDir());
                yield new JsonFilePersistenceGateway(Path.of(persistenceConfig.getDataDir()),
                        snapshotCodec.getObjectMapper());
            }
        };
    }

    @Bean
    public SnapshotCodec snapshotCodec(ObjectMapper objectMapper) {
        return new SnapshotCodec(objectMapper);
    }

    @Bean
    public GraphPersistenceManager graphPersistenceManager(PersistenceGateway persistenceGateway,
                                                           SnapshotCodec snapshotCodec,
                                                           CompressionConfig compressionConfig) {
        return new GraphPersistenceManager(persistenceGateway, snapshotCodec, compressionConfig.getThreshold());
    }
}
