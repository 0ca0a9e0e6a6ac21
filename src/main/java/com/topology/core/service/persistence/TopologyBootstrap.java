package com.topology.core.service.persistence;

import com.topology.core.service.config.TopologyConfig;
import com.topology.core.service.engine.TopologyGraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds the graph store from the last persisted snapshot once the
 * application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologyBootstrap {

    private final TopologyPersistence persistence;
    private final TopologyGraphStore graphStore;
    private final TopologyConfig topologyConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void loadSnapshot() {
        if (!topologyConfig.getFeatures().isLoadSnapshotOnStartup()) {
            log.info("Snapshot loading on startup is disabled");
            return;
        }
        try {
            persistence.loadGraphSnapshot().ifPresentOrElse(
                    snapshot -> {
                        if (graphStore.seed(snapshot)) {
                            log.info("Restored topology v{} from {}", snapshot.version(), persistence.backend());
                        }
                    },
                    () -> log.info("No persisted topology in {}, starting empty", persistence.backend()));
        } catch (RuntimeException e) {
            log.error("Failed to load persisted topology from {}, starting empty", persistence.backend(), e);
        }
    }
}
