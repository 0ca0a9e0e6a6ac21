package com.topology.core.service.persistence;

import com.topology.core.service.model.Device;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.TopologyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds self-contained Cypher statements from a topology snapshot.
 *
 * Statements use MERGE so replaying an export over an existing database
 * converges instead of duplicating nodes.
 */
@Slf4j
@Component
public class CypherBuilder {

    static final String DEVICE_MARKER = ":Device";
    static final String LINK_MARKER = ":LINKED";

    // ==================== Public API ====================

    public List<String> buildCypher(TopologyGraph snapshot) {
        var statements = new ArrayList<String>();
        statements.add(buildMetadataStatement(snapshot));
        snapshot.devices().values().forEach(device -> statements.add(buildDeviceStatement(device)));
        snapshot.links().values().forEach(link -> statements.add(buildLinkStatement(link)));
        log.debug("Generated {} Cypher statements for snapshot v{}", statements.size(), snapshot.version());
        return statements;
    }

    // ==================== Statement Building ====================

    private String buildMetadataStatement(TopologyGraph snapshot) {
        return """
            MERGE (m:TopologyMeta {id: 'current'}) \
            SET m.version = %d, m.publishedAt = %d, m.deviceCount = %d, m.linkCount = %d"""
                .formatted(
                        snapshot.version(),
                        snapshot.createdAt().toEpochMilli(),
                        snapshot.deviceCount(),
                        snapshot.linkCount()
                );
    }

    private String buildDeviceStatement(Device device) {
        var props = new StringBuilder();
        props.append("d.status = '%s'".formatted(device.status().name()));
        props.append(", d.confidence = %s".formatted(device.confidence()));
        if (device.mac() != null) {
            props.append(", d.mac = '%s'".formatted(escape(device.mac())));
        }
        if (device.lastSeen() != null) {
            props.append(", d.lastSeen = %d".formatted(device.lastSeen().toEpochMilli()));
        }
        props.append(", d.sources = %s".formatted(formatList(device.sources())));
        device.attributes().forEach((attribute, value) ->
                props.append(", d.%s = '%s'".formatted(attribute.payloadKey(), escape(value.value()))));
        return "MERGE (d%s {identityKey: '%s'}) SET %s"
                .formatted(DEVICE_MARKER, escape(device.identityKey()), props);
    }

    private String buildLinkStatement(Link link) {
        return """
            MATCH (a:Device {identityKey: '%s'}), (b:Device {identityKey: '%s'}) \
            MERGE (a)-[l%s {linkType: '%s'}]->(b) \
            SET l.state = '%s', l.discoveredVia = %s"""
                .formatted(
                        escape(link.endpointA()),
                        escape(link.endpointB()),
                        LINK_MARKER,
                        link.linkType().name(),
                        link.state().name(),
                        formatList(link.discoveredVia())
                );
    }

    // ==================== Utility Methods ====================

    private String formatList(Iterable<String> values) {
        var items = new ArrayList<String>();
        values.forEach(value -> items.add("'%s'".formatted(escape(value))));
        return items.stream().collect(Collectors.joining(", ", "[", "]"));
    }

    private String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
