package com.topology.core.service.audit;

import com.topology.core.service.config.TopologyConfig;
import com.topology.core.service.model.DiscoveryRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of RecordDeduplicator.
 *
 * Keys records by their fingerprint: source probe, type, target,
 * timestamp and payload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultRecordDeduplicator implements RecordDeduplicator {

    private final TopologyConfig topologyConfig;

    // roundId -> fingerprints
    private final Map<String, Set<String>> seenRecords = new ConcurrentHashMap<>();

    @Override
    public boolean isDuplicate(String roundId, DiscoveryRecord record) {
        if (!topologyConfig.getFeatures().isDeduplicationEnabled()) {
            return false;
        }
        var roundRecords = seenRecords.computeIfAbsent(roundId, k -> ConcurrentHashMap.newKeySet());
        return !roundRecords.add(record.fingerprint());
    }

    @Override
    public void clearRound(String roundId) {
        seenRecords.remove(roundId);
        log.debug("Cleared deduplication state for round: {}", roundId);
    }

    @Override
    public void clearAll() {
        seenRecords.clear();
        log.info("Cleared all deduplication state");
    }

    @Override
    public int size() {
        return seenRecords.values().stream()
                .mapToInt(Set::size)
                .sum();
    }
}
