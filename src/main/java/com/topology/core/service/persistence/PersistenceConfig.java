package com.topology.core.service.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the persistence backend: Neo4j when the connector holds a live
 * driver, process memory otherwise.
 */
@Slf4j
@Configuration
public class PersistenceConfig {

    @Bean
    public TopologyPersistence topologyPersistence(Neo4jConnector connector) {
        return connector.driver()
                .<TopologyPersistence>map(Neo4jTopologyPersistence::new)
                .orElseGet(() -> {
                    log.info("Using in-memory topology persistence");
                    return new InMemoryTopologyPersistence();
                });
    }
}
