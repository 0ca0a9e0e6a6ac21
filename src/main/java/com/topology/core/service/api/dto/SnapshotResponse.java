package com.topology.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.topology.core.service.model.AttributeValue;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.TopologyGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DTO for a topology snapshot with its devices and links.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SnapshotResponse {

    private long version;

    /**
     * When this version was published.
     */
    private Instant createdAt;

    private int deviceCount;

    private int linkCount;

    private List<DeviceResponse> devices;

    private List<LinkResponse> links;

    public static SnapshotResponse from(TopologyGraph snapshot) {
        return SnapshotResponse.builder()
                .version(snapshot.version())
                .createdAt(snapshot.createdAt())
                .deviceCount(snapshot.deviceCount())
                .linkCount(snapshot.linkCount())
                .devices(snapshot.devices().values().stream().map(DeviceResponse::from).toList())
                .links(snapshot.links().values().stream().map(LinkResponse::from).toList())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DeviceResponse {
        private String identityKey;
        private String mac;
        private String displayName;
        private DeviceStatus status;
        private double confidence;
        private Instant firstSeen;
        private Instant lastSeen;
        private Set<String> sources;
        private Set<String> stableIds;

        /**
         * Attribute values with provenance, keyed by attribute name.
         */
        private Map<String, AttributeValue> attributes;

        public static DeviceResponse from(Device device) {
            var attributes = new LinkedHashMap<String, AttributeValue>();
            device.attributes().forEach((attribute, value) -> attributes.put(attribute.payloadKey(), value));
            return DeviceResponse.builder()
                    .identityKey(device.identityKey())
                    .mac(device.mac())
                    .displayName(device.displayName())
                    .status(device.status())
                    .confidence(device.confidence())
                    .firstSeen(device.firstSeen())
                    .lastSeen(device.lastSeen())
                    .sources(device.sources())
                    .stableIds(device.stableIds())
                    .attributes(attributes)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LinkResponse {
        private String endpointA;
        private String endpointB;
        private LinkType linkType;
        private LinkState state;
        private Set<String> discoveredVia;
        private Instant firstSeen;
        private Instant lastSeen;

        public static LinkResponse from(Link link) {
            return LinkResponse.builder()
                    .endpointA(link.endpointA())
                    .endpointB(link.endpointB())
                    .linkType(link.linkType())
                    .state(link.state())
                    .discoveredVia(link.discoveredVia())
                    .firstSeen(link.firstSeen())
                    .lastSeen(link.lastSeen())
                    .build();
        }
    }
}
