package com.topology.core.service.persistence;

import com.topology.core.service.model.AttributeValue;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.DeviceAttribute;
import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.FindingType;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.Severity;
import com.topology.core.service.model.SourceKind;
import com.topology.core.service.model.TopologyGraph;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.types.MapAccessor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Neo4j-backed persistence. Devices are {@code :Device} nodes keyed by
 * identity key, links are {@code :LINKED} relationships between them and
 * findings are standalone {@code :Finding} nodes.
 *
 * Attribute provenance is flattened into node properties named
 * {@code <attribute>}, {@code <attribute>_confidence} and so on.
 */
@Slf4j
public class Neo4jTopologyPersistence implements TopologyPersistence {

    private static final String SAVE_DEVICE = """
            MERGE (d:Device {identityKey: $key}) \
            SET d = $props""";

    private static final String SAVE_LINK = """
            MATCH (a:Device {identityKey: $a}), (b:Device {identityKey: $b}) \
            MERGE (a)-[l:LINKED {linkType: $type}]->(b) \
            SET l.discoveredVia = $via, l.firstSeen = $firstSeen, l.lastSeen = $lastSeen, l.state = $state""";

    private static final String REMOVE_DEVICE = "MATCH (d:Device {identityKey: $key}) DETACH DELETE d";

    private static final String REMOVE_LINK = """
            MATCH (:Device {identityKey: $a})-[l:LINKED {linkType: $type}]->(:Device {identityKey: $b}) \
            DELETE l""";

    private static final String MARK_VERSION = """
            MERGE (m:TopologyMeta {id: 'current'}) \
            SET m.version = $version, m.publishedAt = $publishedAt""";

    private static final String APPEND_FINDING = """
            OPTIONAL MATCH (existing:Finding {findingId: $id}) \
            WITH existing WHERE existing IS NULL \
            CREATE (f:Finding) SET f = $props \
            RETURN f.findingId AS id""";

    private static final String LOAD_META = "MATCH (m:TopologyMeta {id: 'current'}) RETURN m";
    private static final String LOAD_DEVICES = "MATCH (d:Device) RETURN d";
    private static final String LOAD_LINKS = """
            MATCH (a:Device)-[l:LINKED]->(b:Device) \
            RETURN a.identityKey AS a, b.identityKey AS b, l""";
    private static final String LOAD_FINDINGS = """
            MATCH (f:Finding) RETURN f ORDER BY f.detectedAt DESC, f.findingId LIMIT $limit""";

    private final Driver driver;

    public Neo4jTopologyPersistence(Driver driver) {
        this.driver = driver;
    }

    // ==================== Writes ====================

    @Override
    public void saveDevice(Device device) {
        write(SAVE_DEVICE, Map.of("key", device.identityKey(), "props", deviceProperties(device)));
    }

    @Override
    public void saveLink(Link link) {
        var params = new HashMap<String, Object>();
        params.put("a", link.endpointA());
        params.put("b", link.endpointB());
        params.put("type", link.linkType().name());
        params.put("via", List.copyOf(link.discoveredVia()));
        params.put("firstSeen", epochMillis(link.firstSeen()));
        params.put("lastSeen", epochMillis(link.lastSeen()));
        params.put("state", link.state().name());
        write(SAVE_LINK, params);
    }

    @Override
    public void removeDevice(String identityKey) {
        write(REMOVE_DEVICE, Map.of("key", identityKey));
    }

    @Override
    public void removeLink(LinkKey key) {
        write(REMOVE_LINK, Map.of("a", key.endpointA(), "b", key.endpointB(), "type", key.linkType().name()));
    }

    @Override
    public void markVersion(long version, Instant publishedAt) {
        write(MARK_VERSION, Map.of("version", version, "publishedAt", epochMillis(publishedAt)));
    }

    @Override
    public boolean appendFinding(Finding finding) {
        try (var session = driver.session()) {
            return session.executeWrite(tx -> tx.run(APPEND_FINDING,
                    Map.of("id", finding.findingId(), "props", findingProperties(finding))).hasNext());
        }
    }

    // ==================== Reads ====================

    @Override
    public Optional<TopologyGraph> loadGraphSnapshot() {
        try (var session = driver.session()) {
            return session.executeRead(tx -> {
                var meta = tx.run(LOAD_META).list(record -> record.get("m").asNode());
                if (meta.isEmpty()) {
                    return Optional.<TopologyGraph>empty();
                }
                long version = meta.get(0).get("version").asLong(0L);
                var publishedAt = Instant.ofEpochMilli(meta.get(0).get("publishedAt").asLong(0L));

                var devices = new LinkedHashMap<String, Device>();
                tx.run(LOAD_DEVICES).list(record -> toDevice(record.get("d").asNode()))
                        .forEach(device -> devices.put(device.identityKey(), device));

                var links = new LinkedHashMap<LinkKey, Link>();
                tx.run(LOAD_LINKS).list(record -> toLink(record.get("a").asString(),
                                record.get("b").asString(), record.get("l").asRelationship()))
                        .forEach(link -> links.put(link.key(), link));

                log.info("Loaded snapshot v{} from Neo4j: {} devices, {} links", version, devices.size(), links.size());
                return Optional.of(new TopologyGraph(version, publishedAt, devices, links));
            });
        }
    }

    @Override
    public List<Finding> findings(int limit) {
        try (var session = driver.session()) {
            return session.executeRead(tx -> tx.run(LOAD_FINDINGS, Map.of("limit", (long) limit))
                    .list(record -> toFinding(record.get("f").asNode())));
        }
    }

    @Override
    public String backend() {
        return "neo4j";
    }

    // ==================== Mapping ====================

    private Map<String, Object> deviceProperties(Device device) {
        var props = new HashMap<String, Object>();
        props.put("identityKey", device.identityKey());
        if (device.mac() != null) {
            props.put("mac", device.mac());
        }
        props.put("status", device.status().name());
        props.put("confidence", device.confidence());
        props.put("firstSeen", epochMillis(device.firstSeen()));
        props.put("lastSeen", epochMillis(device.lastSeen()));
        props.put("sources", List.copyOf(device.sources()));
        props.put("stableIds", List.copyOf(device.stableIds()));
        device.attributes().forEach((attribute, value) -> {
            var name = attribute.payloadKey();
            props.put(name, value.value());
            props.put(name + "_confidence", value.confidence());
            props.put(name + "_observedAt", epochMillis(value.observedAt()));
            props.put(name + "_sourceKind", value.sourceKind().name());
            props.put(name + "_sourceProbe", value.sourceProbe());
        });
        return props;
    }

    private Device toDevice(MapAccessor node) {
        var attributes = new EnumMap<DeviceAttribute, AttributeValue>(DeviceAttribute.class);
        for (var attribute : DeviceAttribute.values()) {
            var name = attribute.payloadKey();
            var value = node.get(name);
            if (value.isNull()) {
                continue;
            }
            attributes.put(attribute, new AttributeValue(
                    value.asString(),
                    node.get(name + "_confidence").asDouble(0.0),
                    instant(node.get(name + "_observedAt")),
                    SourceKind.valueOf(node.get(name + "_sourceKind").asString(SourceKind.PASSIVE_LISTENER.name())),
                    node.get(name + "_sourceProbe").asString(null)));
        }
        return Device.builder()
                .identityKey(node.get("identityKey").asString())
                .mac(node.get("mac").asString(null))
                .attributes(attributes)
                .status(DeviceStatus.valueOf(node.get("status").asString(DeviceStatus.UNKNOWN.name())))
                .confidence(node.get("confidence").asDouble(0.0))
                .firstSeen(instant(node.get("firstSeen")))
                .lastSeen(instant(node.get("lastSeen")))
                .sources(new TreeSet<>(node.get("sources").asList(Value::asString, List.of())))
                .stableIds(new TreeSet<>(node.get("stableIds").asList(Value::asString, List.of())))
                .build();
    }

    private Link toLink(String a, String b, MapAccessor relationship) {
        var key = LinkKey.of(a, b, LinkType.valueOf(relationship.get("linkType").asString()));
        return Link.builder()
                .key(key)
                .discoveredVia(new TreeSet<>(relationship.get("discoveredVia").asList(Value::asString, List.of())))
                .firstSeen(instant(relationship.get("firstSeen")))
                .lastSeen(instant(relationship.get("lastSeen")))
                .state(LinkState.valueOf(relationship.get("state").asString(LinkState.UP.name())))
                .build();
    }

    private Map<String, Object> findingProperties(Finding finding) {
        var props = new HashMap<String, Object>();
        props.put("findingId", finding.findingId());
        props.put("type", finding.type().name());
        props.put("severity", finding.severity().name());
        props.put("riskScore", finding.riskScore());
        props.put("affectedDevices", finding.affectedDevices());
        props.put("affectedLinks", finding.affectedLinks());
        props.put("description", finding.description());
        props.put("recommendation", finding.recommendation());
        props.put("graphVersion", finding.graphVersion());
        props.put("detectedAt", epochMillis(finding.detectedAt()));
        return props;
    }

    private Finding toFinding(MapAccessor node) {
        return Finding.builder()
                .findingId(node.get("findingId").asString())
                .type(FindingType.valueOf(node.get("type").asString()))
                .severity(Severity.valueOf(node.get("severity").asString()))
                .riskScore(node.get("riskScore").asInt(0))
                .affectedDevices(node.get("affectedDevices").asList(Value::asString, List.of()))
                .affectedLinks(node.get("affectedLinks").asList(Value::asString, List.of()))
                .description(node.get("description").asString(null))
                .recommendation(node.get("recommendation").asString(null))
                .graphVersion(node.get("graphVersion").asLong(0L))
                .detectedAt(instant(node.get("detectedAt")))
                .build();
    }

    // ==================== Helper Methods ====================

    private void write(String cypher, Map<String, Object> params) {
        try (var session = driver.session()) {
            session.executeWrite(tx -> tx.run(cypher, params).consume());
        }
    }

    private static Object epochMillis(Instant instant) {
        return instant == null ? Values.NULL : instant.toEpochMilli();
    }

    private static Instant instant(Value value) {
        return value.isNull() ? null : Instant.ofEpochMilli(value.asLong());
    }
}
