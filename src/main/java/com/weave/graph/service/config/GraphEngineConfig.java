package com.weave.graph.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weave.graph.service.embedding.HttpEmbeddingProvider;
import com.weave.graph.service.engine.EmbeddingProvider;
import com.weave.graph.service.engine.HebbianWeightEngine;
import com.weave.graph.service.engine.SynapticLinker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configuration for the graph engine beans.
 *
 * The linker and Hebbian engine hold configuration only and are shared by
 * every session; per-session state lives in the session's GraphStore.
 */
@Slf4j
@Configuration
public class GraphEngineConfig {

    /**
     * Retroactive linker. Gets an embedding provider when embedding linking is enabled.
     */
    @Bean
    public SynapticLinker synapticLinker(SynapseConfig synapseConfig,
                                         ObjectProvider<EmbeddingProvider> embeddingProvider) {
        var provider = embeddingProvider.getIfAvailable();
        log.info("Initializing SynapticLinker (threshold={}, maxConnections={}, mode={})",
                synapseConfig.getThreshold(), synapseConfig.getMaxConnections(),
                provider != null ? SynapticLinker.MODE_EMBEDDING : SynapticLinker.MODE_KEYWORD);
        return new SynapticLinker(synapseConfig.toOptions(), provider);
    }

    /**
     * Hebbian weight engine.
     */
    @Bean
    public HebbianWeightEngine hebbianWeightEngine(HebbianConfig hebbianConfig) {
        log.info("Initializing HebbianWeightEngine (strength={}, decayRate={}, pruneThreshold={}, maxWeight={})",
                hebbianConfig.getStrength(), hebbianConfig.getDecayRate(),
                hebbianConfig.getPruneThreshold(), hebbianConfig.getMaxWeight());
        return new HebbianWeightEngine(hebbianConfig.toOptions());
    }

    /**
     * OpenAI-compatible embedding provider.
     */
    @Bean
    @ConditionalOnProperty(prefix = "weave.features", name = "embedding-linking-enabled", havingValue = "true")
    public EmbeddingProvider embeddingProvider(EmbeddingConfig embeddingConfig,
                                               ObjectMapper objectMapper,
                                               @Qualifier("embeddingExecutor") ThreadPoolTaskExecutor executor) {
        log.info("Initializing HttpEmbeddingProvider ({} model={})",
                embeddingConfig.getBaseUrl(), embeddingConfig.getModel());
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(embeddingConfig.getTimeoutSeconds()))
                .executor(executor)
                .build();
        return new HttpEmbeddingProvider(httpClient, objectMapper, embeddingConfig);
    }
}
