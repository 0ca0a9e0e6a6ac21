package com.topology.core.service.api.health;

import com.topology.core.service.engine.TopologyGraphStore;
import com.topology.core.service.events.ChangeEventHub;
import com.topology.core.service.persistence.Neo4jConnector;
import com.topology.core.service.persistence.TopologyPersistence;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the current snapshot and the persistence backend in use.
 */
@Component
@RequiredArgsConstructor
public class TopologyStoreHealthIndicator implements HealthIndicator {

    private final TopologyGraphStore graphStore;
    private final TopologyPersistence persistence;
    private final Neo4jConnector neo4jConnector;
    private final ChangeEventHub eventHub;

    @Override
    public Health health() {
        var snapshot = graphStore.current();
        return Health.up()
                .withDetail("version", snapshot.version())
                .withDetail("devices", snapshot.deviceCount())
                .withDetail("links", snapshot.linkCount())
                .withDetail("persistence", persistence.backend())
                .withDetail("neo4jConnected", neo4jConnector.isConnected())
                .withDetail("eventSubscribers", eventHub.subscriberCount())
                .build();
    }
}
