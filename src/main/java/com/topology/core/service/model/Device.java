package com.topology.core.service.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical device in a topology snapshot.
 *
 * Immutable; the identity resolver produces new instances on merge.
 * The identity key is {@code mac:<address>} once a MAC is known and a
 * provisional {@code ip:} or {@code id:} key before that.
 */
@Builder(toBuilder = true)
public record Device(
        String identityKey,
        String mac,
        Map<DeviceAttribute, AttributeValue> attributes,
        DeviceStatus status,
        double confidence,
        Instant firstSeen,
        Instant lastSeen,
        Set<String> sources,
        Set<String> stableIds
) {

    public static final String MAC_KEY_PREFIX = "mac:";
    public static final String IP_KEY_PREFIX = "ip:";
    public static final String STABLE_ID_KEY_PREFIX = "id:";

    public Device {
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(attributes));
        sources = sources == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(sources));
        stableIds = stableIds == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(stableIds));
        status = status == null ? DeviceStatus.UNKNOWN : status;
    }

    public static String macKey(String mac) {
        return MAC_KEY_PREFIX + mac;
    }

    public static String ipKey(String ip) {
        return IP_KEY_PREFIX + ip;
    }

    public static String stableIdKey(String stableId) {
        return STABLE_ID_KEY_PREFIX + stableId;
    }

    /**
     * A device is provisional until a MAC address anchors its identity.
     */
    public boolean isProvisional() {
        return mac == null;
    }

    public Optional<String> attribute(DeviceAttribute attribute) {
        return Optional.ofNullable(attributes.get(attribute)).map(AttributeValue::value);
    }

    public String ip() {
        return attribute(DeviceAttribute.IP_ADDRESS).orElse(null);
    }

    public String hostname() {
        return attribute(DeviceAttribute.HOSTNAME).orElse(null);
    }

    /**
     * Human readable name, falling back through hostname, address and key.
     */
    public String displayName() {
        if (hostname() != null) return hostname();
        if (ip() != null) return ip();
        return identityKey;
    }

    public Device withStatus(DeviceStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }
}
