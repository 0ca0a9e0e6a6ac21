package com.topology.core.service.discovery;

import com.topology.core.service.config.TopologyConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Periodically queues a round over the configured inventory when enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledDiscovery {

    private final DiscoveryService discoveryService;
    private final TargetInventory inventory;
    private final TopologyConfig topologyConfig;

    @Scheduled(fixedDelayString = "${topology.discovery.schedule.interval-ms:300000}",
            initialDelayString = "${topology.discovery.schedule.initial-delay-ms:30000}")
    public void runScheduledRound() {
        if (!topologyConfig.getFeatures().isScheduledDiscoveryEnabled() || inventory.isEmpty()) {
            return;
        }
        try {
            var roundId = discoveryService.submitInventory(Set.of(), null, DiscoveryService.TRIGGER_SCHEDULE);
            log.debug("Scheduled round {} queued", roundId);
        } catch (DiscoveryException e) {
            log.warn("Scheduled round not queued: {} [{}]", e.getMessage(), e.getErrorCode());
        }
    }
}
