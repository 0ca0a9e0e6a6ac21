package com.topology.core.service.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, versioned snapshot of the topology.
 *
 * Devices are keyed by identity key and links by {@link LinkKey}; there are
 * no object references between devices and links.
 */
public record TopologyGraph(
        long version,
        Instant createdAt,
        Map<String, Device> devices,
        Map<LinkKey, Link> links
) {

    public TopologyGraph {
        devices = devices == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(devices));
        links = links == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(links));
    }

    public static TopologyGraph empty() {
        return new TopologyGraph(0L, Instant.EPOCH, Map.of(), Map.of());
    }

    public Optional<Device> findDevice(String identityKey) {
        return Optional.ofNullable(devices.get(identityKey));
    }

    public int deviceCount() {
        return devices.size();
    }

    public int linkCount() {
        return links.size();
    }

    public boolean hasSameContent(Map<String, Device> otherDevices, Map<LinkKey, Link> otherLinks) {
        return devices.equals(otherDevices) && links.equals(otherLinks);
    }
}
