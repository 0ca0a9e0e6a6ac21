package com.topology.core.service.api.health;

import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.discovery.RoundQueue;
import com.topology.core.service.discovery.RoundWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the discovery round queue.
 *
 * Reports down once queue utilization reaches the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class DiscoveryQueueHealthIndicator implements HealthIndicator {

    private final RoundQueue queue;
    private final RoundWorker worker;
    private final DiscoveryConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("queueSize", queue.size())
                .withDetail("queueCapacity", queue.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("activeWorkers", worker.getActiveWorkerCount())
                .withDetail("isFull", queue.isFull())
                .build();
    }
}
