package com.topology.core.service.engine;

import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.config.RetentionConfig;
import com.topology.core.service.events.ChangeType;
import com.topology.core.service.events.TopologyChangeEvent;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.GraphDelta;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.TopologyGraph;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory, versioned implementation of TopologyGraphStore.
 *
 * The current snapshot sits behind an atomic reference and is replaced
 * wholesale; one apply runs at a time under the store lock. A bounded
 * history of recent snapshots backs version lookups and diffs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VersionedTopologyGraphStore implements TopologyGraphStore {

    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<TopologyGraph> current = new AtomicReference<>(TopologyGraph.empty());
    private final ReentrantLock applyLock = new ReentrantLock();
    private final ReentrantLock publishLock = new ReentrantLock();

    // Guarded by applyLock for writes; reads synchronize on the map.
    private final Map<Long, TopologyGraph> history = new LinkedHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        remember(current.get());
        metricsConfig.registerStoreGauge(
                "topology.store.devices.count",
                "Number of devices in the current snapshot",
                () -> current.get().deviceCount()
        );
        metricsConfig.registerStoreGauge(
                "topology.store.links.count",
                "Number of links in the current snapshot",
                () -> current.get().linkCount()
        );
        metricsConfig.registerStoreGauge(
                "topology.store.version",
                "Current snapshot version",
                () -> current.get().version()
        );
        log.info("VersionedTopologyGraphStore initialized, grace: {}, retention: {}, history: {}",
                retentionConfig.getDevice().getGracePeriod(),
                retentionConfig.getDevice().getRetentionPeriod(),
                retentionConfig.getSnapshot().getHistorySize());
    }

    // ==================== TopologyGraphStore Interface ====================

    @Override
    public TopologyGraph current() {
        return current.get();
    }

    /**
     * Applies a delta under the apply lock. Change events are built under the
     * lock but published after it is released, so listeners never hold up
     * the next apply; the publish lock is taken before the apply lock is
     * released to keep events in version order.
     */
    @Override
    public TopologyGraph apply(GraphDelta delta, Instant now) {
        var sample = Timer.start(metricsConfig.getRegistry());
        List<TopologyChangeEvent> events;
        TopologyGraph next;
        applyLock.lock();
        try {
            var previous = current.get();
            var devices = new HashMap<>(previous.devices());
            var links = new LinkedHashMap<>(previous.links());

            applyDelta(delta, devices, links);
            validate(delta.roundId(), devices, links);
            sweep(devices, links, now);
            validate(delta.roundId(), devices, links);

            if (previous.hasSameContent(devices, links)) {
                log.debug("Delta {} changed nothing, staying at version {}", delta.roundId(), previous.version());
                return previous;
            }

            next = new TopologyGraph(previous.version() + 1, now, devices, links);
            current.set(next);
            remember(next);
            metricsConfig.getSnapshotsApplied().increment();
            log.info("Published snapshot v{} for {}: {} devices, {} links",
                    next.version(), delta.roundId(), next.deviceCount(), next.linkCount());

            events = changeEvents(GraphDiff.between(previous, next), now);
            publishLock.lock();
        } finally {
            applyLock.unlock();
            sample.stop(metricsConfig.getApplyTimer());
        }

        try {
            publish(events);
        } finally {
            publishLock.unlock();
        }
        return next;
    }

    @Override
    public Optional<TopologyGraph> findVersion(long version) {
        synchronized (history) {
            return Optional.ofNullable(history.get(version));
        }
    }

    @Override
    public GraphDiff diff(long fromVersion, long toVersion) {
        var older = findVersion(fromVersion).orElseThrow(() -> new SnapshotNotFoundException(fromVersion));
        var newer = findVersion(toVersion).orElseThrow(() -> new SnapshotNotFoundException(toVersion));
        return GraphDiff.between(older, newer);
    }

    @Override
    public boolean seed(TopologyGraph snapshot) {
        applyLock.lock();
        try {
            if (current.get().version() != 0 || snapshot.version() <= 0) {
                return false;
            }
            validate("seed", snapshot.devices(), snapshot.links());
            current.set(snapshot);
            remember(snapshot);
            log.info("Seeded store with snapshot v{}: {} devices, {} links",
                    snapshot.version(), snapshot.deviceCount(), snapshot.linkCount());
            return true;
        } finally {
            applyLock.unlock();
        }
    }

    // ==================== Delta Application ====================

    private void applyDelta(GraphDelta delta, Map<String, Device> devices, Map<LinkKey, Link> links) {
        delta.deviceRemovals().forEach(devices::remove);
        delta.linkRemovals().forEach(links::remove);
        for (var device : delta.deviceUpserts()) {
            devices.put(device.identityKey(), device);
        }
        for (var link : delta.linkUpserts()) {
            links.put(link.key(), link);
        }
    }

    private void validate(String roundId, Map<String, Device> devices, Map<LinkKey, Link> links) {
        for (var key : links.keySet()) {
            if (!devices.containsKey(key.endpointA()) || !devices.containsKey(key.endpointB())) {
                throw new GraphInvariantViolationException(roundId,
                        "Link " + key + " references a device missing from the snapshot");
            }
            if (key.isSelfLink()) {
                throw new GraphInvariantViolationException(roundId, "Self link " + key);
            }
        }
    }

    // ==================== Lifecycle Sweep ====================

    /**
     * Marks devices unseen for the grace period OFFLINE and prunes those unseen
     * for the retention period. A link is DOWN while it is past its own grace
     * period or either endpoint is OFFLINE, and goes with whichever of itself
     * or its endpoints is pruned first.
     */
    private void sweep(Map<String, Device> devices, Map<LinkKey, Link> links, Instant now) {
        var grace = retentionConfig.getDevice().getGracePeriod();
        var retention = retentionConfig.getDevice().getRetentionPeriod();

        for (var device : new ArrayList<>(devices.values())) {
            var age = age(device.lastSeen(), now);
            if (age.compareTo(retention) >= 0) {
                devices.remove(device.identityKey());
                log.debug("Pruned device {} unseen for {}", device.identityKey(), age);
            } else if (age.compareTo(grace) >= 0 && device.status() != DeviceStatus.OFFLINE) {
                devices.put(device.identityKey(), device.withStatus(DeviceStatus.OFFLINE));
            }
        }

        for (var link : new ArrayList<>(links.values())) {
            var a = devices.get(link.endpointA());
            var b = devices.get(link.endpointB());
            var age = age(link.lastSeen(), now);
            if (a == null || b == null || age.compareTo(retention) >= 0) {
                links.remove(link.key());
                continue;
            }
            boolean down = age.compareTo(grace) >= 0
                    || a.status() == DeviceStatus.OFFLINE
                    || b.status() == DeviceStatus.OFFLINE;
            var state = down ? LinkState.DOWN : LinkState.UP;
            if (state != link.state()) {
                links.put(link.key(), link.withState(state));
            }
        }
    }

    private static Duration age(Instant lastSeen, Instant now) {
        if (lastSeen == null || now.isBefore(lastSeen)) {
            return Duration.ZERO;
        }
        return Duration.between(lastSeen, now);
    }

    // ==================== Helper Methods ====================

    private void remember(TopologyGraph snapshot) {
        int limit = Math.max(1, retentionConfig.getSnapshot().getHistorySize());
        synchronized (history) {
            history.put(snapshot.version(), snapshot);
            var iterator = history.keySet().iterator();
            while (history.size() > limit && iterator.hasNext()) {
                iterator.next();
                iterator.remove();
            }
        }
    }

    private static List<TopologyChangeEvent> changeEvents(GraphDiff diff, Instant now) {
        var events = new ArrayList<TopologyChangeEvent>();
        long version = diff.toVersion();
        diff.addedDevices().forEach(key ->
                events.add(new TopologyChangeEvent(ChangeType.DEVICE_ADDED, key, null, null, version, now)));
        diff.removedDevices().forEach(key ->
                events.add(new TopologyChangeEvent(ChangeType.DEVICE_REMOVED, key, null, null, version, now)));
        diff.statusChanges().forEach(change ->
                events.add(new TopologyChangeEvent(ChangeType.DEVICE_STATUS_CHANGED, change.identityKey(),
                        change.from().name(), change.to().name(), version, now)));
        diff.addedLinks().forEach(key ->
                events.add(new TopologyChangeEvent(ChangeType.LINK_ADDED, key.toString(), null, null, version, now)));
        diff.removedLinks().forEach(key ->
                events.add(new TopologyChangeEvent(ChangeType.LINK_REMOVED, key.toString(), null, null, version, now)));
        diff.stateChanges().forEach(change ->
                events.add(new TopologyChangeEvent(ChangeType.LINK_STATE_CHANGED, change.key().toString(),
                        change.from().name(), change.to().name(), version, now)));
        return events;
    }

    private void publish(List<TopologyChangeEvent> events) {
        for (var event : events) {
            try {
                eventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                log.warn("Change event listener failed for {} {}: {}", event.type(), event.subject(), e.getMessage());
            }
        }
    }
}
