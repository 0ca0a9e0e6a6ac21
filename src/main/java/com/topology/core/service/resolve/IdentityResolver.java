package com.topology.core.service.resolve;

import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.discovery.RoundResult;
import com.topology.core.service.model.AttributeValue;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.DeviceAttribute;
import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.FindingType;
import com.topology.core.service.model.GraphDelta;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.ObservationFields;
import com.topology.core.service.model.RecordType;
import com.topology.core.service.model.Severity;
import com.topology.core.service.model.TopologyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the raw records of a round into a delta against the current snapshot.
 *
 * Records are sorted into a fixed order before merging, so the result does
 * not depend on the order in which probes returned. Devices are matched by
 * MAC, then IP, then stable id; devices without a MAC stay provisional and
 * are re-keyed once a MAC-bearing record links them to one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    static final int CONFLICT_RISK_SCORE = 40;

    private static final Comparator<DiscoveryRecord> RECORD_ORDER = Comparator
            .comparing(DiscoveryRecord::type)
            .thenComparing(DiscoveryRecord::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(record -> record.sourceKind().rank())
            .thenComparing(DiscoveryRecord::sourceProbe, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DiscoveryRecord::target, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(record -> record.payload().toString());

    private final MetricsConfig metricsConfig;

    // ==================== Resolution ====================

    /**
     * Resolves a round against {@code current}. Never throws for bad input:
     * unusable records are dropped and counted, binding conflicts become findings.
     */
    public GraphDelta resolve(RoundResult round, TopologyGraph current) {
        var observedAt = round.finishedAt() != null ? round.finishedAt() : Instant.now();
        var work = new WorkingSet(round.roundId(), current, observedAt);

        var records = new ArrayList<>(round.records());
        records.sort(RECORD_ORDER);

        int resolved = 0;
        for (var record : records) {
            boolean used = record.type() == RecordType.LINK
                    ? work.mergeLink(record)
                    : work.mergeDevice(record);
            if (used) {
                resolved++;
            } else {
                metricsConfig.getRecordsDropped().increment();
                log.warn("Dropped unusable {} record from {} on {}", record.type(), record.sourceProbe(), record.target());
            }
        }
        metricsConfig.getRecordsResolved().increment(resolved);

        var delta = work.toDelta();
        log.info("Round {} resolved: {} records, {} device upserts, {} link upserts, {} re-keys, {} conflicts",
                round.roundId(), resolved, delta.deviceUpserts().size(), delta.linkUpserts().size(),
                delta.rekeys().size(), delta.findings().size());
        return delta;
    }

    // ==================== Working Set ====================

    /**
     * Mutable copy of the current snapshot plus lookup indexes, scoped to one
     * resolve call.
     */
    private final class WorkingSet {

        private final String roundId;
        private final TopologyGraph current;
        private final Instant observedAt;
        private final Map<String, Device> devices;
        private final Map<LinkKey, Link> links;
        private final Map<String, String> ipIndex = new HashMap<>();
        private final Map<String, String> stableIndex = new HashMap<>();
        private final Map<String, String> rekeys = new LinkedHashMap<>();
        private final Map<String, Finding> conflicts = new LinkedHashMap<>();

        WorkingSet(String roundId, TopologyGraph current, Instant observedAt) {
            this.roundId = roundId;
            this.current = current;
            this.observedAt = observedAt;
            this.devices = new HashMap<>(current.devices());
            this.links = new LinkedHashMap<>(current.links());
            for (var device : devices.values()) {
                index(device);
            }
        }

        // ---------- Devices ----------

        boolean mergeDevice(DiscoveryRecord record) {
            var identity = ObservedIdentity.read(record, "");
            var key = locate(identity, record);
            if (key == null) {
                return false;
            }
            var device = devices.get(key);
            var attributes = new EnumMap<DeviceAttribute, AttributeValue>(DeviceAttribute.class);
            attributes.putAll(device.attributes());
            for (var attribute : DeviceAttribute.values()) {
                if (attribute == DeviceAttribute.IP_ADDRESS) {
                    continue;
                }
                var raw = record.field(attribute.payloadKey());
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                var candidate = valueOf(raw.trim(), record);
                attributes.put(attribute, AttributePrecedence.pick(attributes.get(attribute), candidate));
            }

            var reported = record.field(ObservationFields.STATUS);
            DeviceStatus status;
            if (reported != null) {
                status = DeviceStatus.fromObservation(reported);
            } else if (device.status() == DeviceStatus.MAINTENANCE) {
                status = DeviceStatus.MAINTENANCE;
            } else {
                status = DeviceStatus.ONLINE;
            }

            devices.put(key, device.toBuilder()
                    .attributes(attributes)
                    .status(status)
                    .confidence(Math.max(device.confidence(), record.confidenceHint()))
                    .build());
            return true;
        }

        /**
         * Finds or creates the device a set of identity candidates refers to,
         * binding the IP and stable id to it. Returns null if there is nothing
         * to identify the device by.
         */
        private String locate(ObservedIdentity identity, DiscoveryRecord record) {
            if (identity.isEmpty()) {
                return null;
            }
            String key;
            if (identity.mac() != null) {
                key = locateByMac(identity, record);
            } else {
                key = locateProvisional(identity, record);
            }
            if (identity.ip() != null) {
                bindIp(key, identity.ip(), record);
            }
            if (identity.stableId() != null) {
                bindStableId(key, identity.stableId());
            }
            touch(key, record);
            return key;
        }

        private String locateByMac(ObservedIdentity identity, DiscoveryRecord record) {
            var macKey = Device.macKey(identity.mac());
            var byIp = provisionalOwner(ipIndex.get(identity.ip()), macKey);
            var byStable = provisionalOwner(stableIndex.get(identity.stableId()), macKey);

            if (!devices.containsKey(macKey)) {
                devices.put(macKey, Device.builder()
                        .identityKey(macKey)
                        .mac(identity.mac())
                        .status(DeviceStatus.ONLINE)
                        .firstSeen(record.timestamp())
                        .lastSeen(record.timestamp())
                        .build());
            }
            if (byIp != null) {
                fold(byIp, macKey);
            }
            if (byStable != null && devices.containsKey(byStable)) {
                fold(byStable, macKey);
            }
            return macKey;
        }

        private String locateProvisional(ObservedIdentity identity, DiscoveryRecord record) {
            var existing = identity.ip() != null ? ipIndex.get(identity.ip()) : null;
            if (existing == null && identity.stableId() != null) {
                existing = stableIndex.get(identity.stableId());
            }
            if (existing != null) {
                return existing;
            }
            var key = identity.ip() != null
                    ? Device.ipKey(identity.ip())
                    : Device.stableIdKey(identity.stableId());
            devices.put(key, Device.builder()
                    .identityKey(key)
                    .status(DeviceStatus.ONLINE)
                    .firstSeen(record.timestamp())
                    .lastSeen(record.timestamp())
                    .build());
            return key;
        }

        private String provisionalOwner(String owner, String macKey) {
            if (owner == null || owner.equals(macKey)) {
                return null;
            }
            var device = devices.get(owner);
            return device != null && device.isProvisional() ? owner : null;
        }

        private void bindIp(String key, String ip, DiscoveryRecord record) {
            var owner = ipIndex.get(ip);
            if (owner != null && !owner.equals(key)) {
                conflict(List.of(owner, key), ip, String.format(
                        "IP %s is bound to %s but %s reports it for %s",
                        ip, owner, record.sourceProbe(), key));
                return;
            }
            var device = devices.get(key);
            var bound = device.attributes().get(DeviceAttribute.IP_ADDRESS);
            var candidate = valueOf(ip, record);
            if (bound != null && !bound.value().equals(ip)) {
                if (!Objects.equals(bound.sourceProbe(), record.sourceProbe())) {
                    conflict(List.of(key), ip, String.format(
                            "%s is bound to IP %s by %s but %s reports IP %s",
                            key, bound.value(), bound.sourceProbe(), record.sourceProbe(), ip));
                    return;
                }
                if (!AttributePrecedence.supersedes(candidate, bound)) {
                    return;
                }
                ipIndex.remove(bound.value(), key);
            }
            var attributes = new EnumMap<DeviceAttribute, AttributeValue>(DeviceAttribute.class);
            attributes.putAll(device.attributes());
            attributes.put(DeviceAttribute.IP_ADDRESS, AttributePrecedence.pick(bound, candidate));
            devices.put(key, device.toBuilder().attributes(attributes).build());
            ipIndex.put(ip, key);
        }

        private void bindStableId(String key, String stableId) {
            var owner = stableIndex.get(stableId);
            if (owner != null && !owner.equals(key)) {
                log.debug("Stable id {} already belongs to {}, not adding to {}", stableId, owner, key);
                return;
            }
            var device = devices.get(key);
            if (!device.stableIds().contains(stableId)) {
                var stableIds = new TreeSet<>(device.stableIds());
                stableIds.add(stableId);
                devices.put(key, device.toBuilder().stableIds(stableIds).build());
            }
            stableIndex.put(stableId, key);
        }

        /**
         * Records the observation time and source on a device.
         */
        private void touch(String key, DiscoveryRecord record) {
            var device = devices.get(key);
            var sources = new TreeSet<>(device.sources());
            sources.add(record.sourceProbe());
            var status = device.status() == DeviceStatus.OFFLINE && isAfter(record.timestamp(), device.lastSeen())
                    ? DeviceStatus.ONLINE : device.status();
            devices.put(key, device.toBuilder()
                    .sources(sources)
                    .status(status)
                    .firstSeen(earliest(device.firstSeen(), record.timestamp()))
                    .lastSeen(latest(device.lastSeen(), record.timestamp()))
                    .build());
        }

        /**
         * Folds provisional device {@code from} into {@code to}, rewriting its
         * index entries and links.
         */
        private void fold(String from, String to) {
            var source = devices.remove(from);
            var target = devices.get(to);
            if (source == null || target == null) {
                return;
            }

            var attributes = new EnumMap<DeviceAttribute, AttributeValue>(DeviceAttribute.class);
            attributes.putAll(target.attributes());
            source.attributes().forEach((attribute, value) ->
                    attributes.put(attribute, AttributePrecedence.pick(attributes.get(attribute), value)));
            var sources = new TreeSet<>(target.sources());
            sources.addAll(source.sources());
            var stableIds = new TreeSet<>(target.stableIds());
            stableIds.addAll(source.stableIds());
            var status = isAfter(source.lastSeen(), target.lastSeen()) ? source.status() : target.status();

            devices.put(to, target.toBuilder()
                    .attributes(attributes)
                    .sources(sources)
                    .stableIds(stableIds)
                    .status(status)
                    .confidence(Math.max(source.confidence(), target.confidence()))
                    .firstSeen(earliest(target.firstSeen(), source.firstSeen()))
                    .lastSeen(latest(target.lastSeen(), source.lastSeen()))
                    .build());

            ipIndex.replaceAll((ip, owner) -> owner.equals(from) ? to : owner);
            stableIndex.replaceAll((id, owner) -> owner.equals(from) ? to : owner);
            rekeys.replaceAll((old, canonical) -> canonical.equals(from) ? to : canonical);
            rekeys.put(from, to);

            for (var key : new ArrayList<>(links.keySet())) {
                if (!key.involves(from)) {
                    continue;
                }
                var link = links.remove(key);
                var moved = key.rekey(from, to);
                if (moved.isSelfLink()) {
                    continue;
                }
                links.merge(moved, link.toBuilder().key(moved).build(), this::combine);
            }
            log.debug("Re-keyed provisional device {} into {}", from, to);
        }

        // ---------- Links ----------

        boolean mergeLink(DiscoveryRecord record) {
            LinkType linkType;
            try {
                var raw = record.field(ObservationFields.LINK_TYPE);
                linkType = raw == null ? LinkType.PHYSICAL : LinkType.valueOf(raw.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return false;
            }
            var a = ObservedIdentity.read(record, ObservationFields.ENDPOINT_A);
            var b = ObservedIdentity.read(record, ObservationFields.ENDPOINT_B);
            if (a.isEmpty() || b.isEmpty()) {
                return false;
            }
            var keyA = locate(a, record);
            var keyB = locate(b, record);
            // Locating b may have folded a into another device.
            keyA = rekeys.getOrDefault(keyA, keyA);
            var linkKey = LinkKey.of(keyA, keyB, linkType);
            if (linkKey.isSelfLink()) {
                log.debug("Dropping self link on {} from {}", keyA, record.sourceProbe());
                return true;
            }
            var observed = Link.builder()
                    .key(linkKey)
                    .discoveredVia(Set.of(record.sourceProbe()))
                    .firstSeen(record.timestamp())
                    .lastSeen(record.timestamp())
                    .state(LinkState.UP)
                    .build();
            links.merge(linkKey, observed, this::combine);
            return true;
        }

        private Link combine(Link existing, Link observed) {
            var via = new TreeSet<>(existing.discoveredVia());
            via.addAll(observed.discoveredVia());
            var state = existing.state() == LinkState.UP || observed.state() == LinkState.UP
                    ? LinkState.UP : LinkState.DOWN;
            if (observed.lastSeen() != null && isAfter(observed.lastSeen(), existing.lastSeen())) {
                state = observed.state();
            }
            return existing.toBuilder()
                    .discoveredVia(via)
                    .firstSeen(earliest(existing.firstSeen(), observed.firstSeen()))
                    .lastSeen(latest(existing.lastSeen(), observed.lastSeen()))
                    .state(state)
                    .build();
        }

        // ---------- Findings ----------

        private void conflict(List<String> devicesInvolved, String ip, String description) {
            var affected = devicesInvolved.stream().sorted().toList();
            var findingId = Finding.deriveId(FindingType.RESOLVER_CONFLICT, affected, List.of("ip=" + ip));
            if (conflicts.containsKey(findingId)) {
                return;
            }
            metricsConfig.getResolverConflicts().increment();
            log.warn("Identity conflict in round {}: {}", roundId, description);
            conflicts.put(findingId, Finding.builder()
                    .findingId(findingId)
                    .type(FindingType.RESOLVER_CONFLICT)
                    .severity(Severity.MEDIUM)
                    .riskScore(CONFLICT_RISK_SCORE)
                    .affectedDevices(affected)
                    .description(description)
                    .recommendation("Verify the MAC to IP binding manually; the existing binding was kept")
                    .graphVersion(current.version())
                    .detectedAt(observedAt)
                    .build());
        }

        // ---------- Output ----------

        GraphDelta toDelta() {
            var deviceUpserts = devices.values().stream()
                    .filter(device -> !device.equals(current.devices().get(device.identityKey())))
                    .sorted(Comparator.comparing(Device::identityKey))
                    .toList();
            var deviceRemovals = new HashSet<>(current.devices().keySet());
            deviceRemovals.removeAll(devices.keySet());

            var linkUpserts = links.values().stream()
                    .filter(link -> !link.equals(current.links().get(link.key())))
                    .sorted(Comparator.comparing(link -> link.key().toString()))
                    .toList();
            var linkRemovals = new HashSet<>(current.links().keySet());
            linkRemovals.removeAll(links.keySet());

            return new GraphDelta(roundId, observedAt, deviceUpserts, deviceRemovals,
                    linkUpserts, linkRemovals, rekeys, List.copyOf(conflicts.values()));
        }

        private void index(Device device) {
            var ip = device.ip();
            if (ip != null) {
                ipIndex.putIfAbsent(ip, device.identityKey());
            }
            for (var stableId : device.stableIds()) {
                stableIndex.putIfAbsent(stableId, device.identityKey());
            }
        }
    }

    // ==================== Helper Methods ====================

    private static AttributeValue valueOf(String value, DiscoveryRecord record) {
        return new AttributeValue(value, record.confidenceHint(), record.timestamp(),
                record.sourceKind(), record.sourceProbe());
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static boolean isAfter(Instant a, Instant b) {
        return a != null && (b == null || a.isAfter(b));
    }
}
