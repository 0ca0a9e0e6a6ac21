package com.topology.core.service.persistence;

import com.topology.core.service.config.TopologyConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Owns the Neo4j driver shared by persistence and export.
 */
@Slf4j
@Component
public class Neo4jConnector {

    private final TopologyConfig topologyConfig;

    @Value("${topology.neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${topology.neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${topology.neo4j.password:password}")
    private String neo4jPassword;

    private Driver driver;
    private volatile boolean connected = false;

    public Neo4jConnector(TopologyConfig topologyConfig) {
        this.topologyConfig = topologyConfig;
    }

    @PostConstruct
    void init() {
        if (topologyConfig.getFeatures().isNeo4jExportEnabled()) {
            initializeDriver();
        } else {
            log.info("Neo4j export is disabled");
        }
    }

    @PreDestroy
    void cleanup() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j driver closed");
        }
    }

    public boolean isConnected() {
        return connected && driver != null;
    }

    public Optional<Driver> driver() {
        return isConnected() ? Optional.of(driver) : Optional.empty();
    }

    private void initializeDriver() {
        try {
            driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
            driver.verifyConnectivity();
            connected = true;
            log.info("Connected to Neo4j at {}", neo4jUri);
        } catch (Exception e) {
            log.warn("Failed to connect to Neo4j at {}: {}", neo4jUri, e.getMessage());
            connected = false;
        }
    }
}
