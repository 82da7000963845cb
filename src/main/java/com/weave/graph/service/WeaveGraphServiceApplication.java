package com.weave.graph.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Weave Graph Service Application - Entry point for the Spring Boot application.
 *
 * Hosts one knowledge graph per chat session and serves it as agent memory:
 * - New nodes are linked retroactively to similar existing nodes
 * - Edges traversed together are strengthened and idle ones decay
 * - Low-importance nodes are archived when the context window fills up
 * - Sessions are persisted as JSON snapshots through a pluggable gateway
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.weave.graph.service.config")
public class WeaveGraphServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WeaveGraphServiceApplication.class, args);
    }
}
