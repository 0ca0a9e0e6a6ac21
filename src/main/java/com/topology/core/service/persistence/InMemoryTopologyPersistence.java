package com.topology.core.service.persistence;

import com.topology.core.service.model.Device;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.TopologyGraph;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local persistence used when no graph database is configured.
 */
@Slf4j
public class InMemoryTopologyPersistence implements TopologyPersistence {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final Map<LinkKey, Link> links = new ConcurrentHashMap<>();
    private final Map<String, Finding> findings = Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile long version;
    private volatile Instant publishedAt = Instant.EPOCH;

    @Override
    public void saveDevice(Device device) {
        devices.put(device.identityKey(), device);
    }

    @Override
    public void saveLink(Link link) {
        links.put(link.key(), link);
    }

    @Override
    public void removeDevice(String identityKey) {
        devices.remove(identityKey);
    }

    @Override
    public void removeLink(LinkKey key) {
        links.remove(key);
    }

    @Override
    public void markVersion(long version, Instant publishedAt) {
        this.version = version;
        this.publishedAt = publishedAt;
    }

    @Override
    public Optional<TopologyGraph> loadGraphSnapshot() {
        if (version == 0) {
            return Optional.empty();
        }
        var deviceCopy = Map.copyOf(devices);
        var linkCopy = links.values().stream()
                .filter(link -> deviceCopy.containsKey(link.endpointA()) && deviceCopy.containsKey(link.endpointB()))
                .collect(Collectors.toMap(Link::key, link -> link, (a, b) -> a, LinkedHashMap::new));
        return Optional.of(new TopologyGraph(version, publishedAt, deviceCopy, linkCopy));
    }

    @Override
    public boolean appendFinding(Finding finding) {
        boolean added = findings.putIfAbsent(finding.findingId(), finding) == null;
        if (added) {
            log.debug("Stored finding {} ({})", finding.findingId(), finding.type());
        }
        return added;
    }

    @Override
    public List<Finding> findings(int limit) {
        List<Finding> all;
        synchronized (findings) {
            all = new ArrayList<>(findings.values());
        }
        Collections.reverse(all);
        return all.stream().limit(Math.max(0, limit)).toList();
    }

    @Override
    public String backend() {
        return "in-memory";
    }
}
