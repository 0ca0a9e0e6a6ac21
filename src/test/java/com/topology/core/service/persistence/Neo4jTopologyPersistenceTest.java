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
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Round-trips a snapshot through a real Neo4j instance.
 */
@Testcontainers(disabledWithoutDocker = true)
class Neo4jTopologyPersistenceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SW1 = "mac:aa:bb:cc:dd:ee:ff";
    private static final String AP1 = "mac:11:22:33:44:55:66";

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withoutAuthentication();

    private static Driver driver;

    private Neo4jTopologyPersistence persistence;

    @BeforeAll
    static void connect() {
        driver = GraphDatabase.driver(neo4jContainer.getBoltUrl(), AuthTokens.none());
    }

    @AfterAll
    static void disconnect() {
        driver.close();
    }

    @BeforeEach
    void setUp() {
        try (var session = driver.session()) {
            session.run("MATCH (n) DETACH DELETE n").consume();
        }
        persistence = new Neo4jTopologyPersistence(driver);
    }

    @Test
    void reportsNothingSavedOnEmptyDatabase() {
        assertThat(persistence.loadGraphSnapshot()).isEmpty();
    }

    @Test
    void roundTripsDevicesAndLinks() {
        var sw1 = Device.builder()
                .identityKey(SW1)
                .mac("aa:bb:cc:dd:ee:ff")
                .attributes(Map.of(
                        DeviceAttribute.HOSTNAME,
                        new AttributeValue("sw1", 0.9, NOW, SourceKind.ACTIVE_QUERY, "snmp-query"),
                        DeviceAttribute.IP_ADDRESS,
                        new AttributeValue("10.0.0.1", 0.9, NOW, SourceKind.ACTIVE_QUERY, "snmp-query")))
                .status(DeviceStatus.ONLINE)
                .confidence(0.9)
                .firstSeen(NOW)
                .lastSeen(NOW)
                .sources(Set.of("snmp-query", "lldp-listener"))
                .build();
        var ap1 = Device.builder()
                .identityKey(AP1)
                .mac("11:22:33:44:55:66")
                .status(DeviceStatus.OFFLINE)
                .firstSeen(NOW)
                .lastSeen(NOW)
                .build();
        var link = Link.builder()
                .key(LinkKey.of(SW1, AP1, LinkType.PHYSICAL))
                .discoveredVia(Set.of("lldp-listener"))
                .firstSeen(NOW)
                .lastSeen(NOW)
                .state(LinkState.DOWN)
                .build();

        persistence.saveDevice(sw1);
        persistence.saveDevice(ap1);
        persistence.saveLink(link);
        persistence.markVersion(3, NOW);

        var snapshot = persistence.loadGraphSnapshot().orElseThrow();
        assertThat(snapshot.version()).isEqualTo(3);
        assertThat(snapshot.createdAt()).isEqualTo(NOW);
        assertThat(snapshot.devices().get(SW1)).isEqualTo(sw1);
        assertThat(snapshot.devices().get(AP1)).isEqualTo(ap1);
        assertThat(snapshot.links()).containsEntry(link.key(), link);
    }

    @Test
    void removesDevicesAndLinks() {
        persistence.saveDevice(Device.builder().identityKey(SW1).status(DeviceStatus.ONLINE).build());
        persistence.saveDevice(Device.builder().identityKey(AP1).status(DeviceStatus.ONLINE).build());
        var key = LinkKey.of(SW1, AP1, LinkType.INFERRED);
        persistence.saveLink(Link.builder().key(key).discoveredVia(Set.of("snmp-query")).build());

        persistence.removeLink(key);
        persistence.removeDevice(AP1);
        persistence.markVersion(1, NOW);

        var snapshot = persistence.loadGraphSnapshot().orElseThrow();
        assertThat(snapshot.devices()).containsOnlyKeys(SW1);
        assertThat(snapshot.links()).isEmpty();
    }

    @Test
    void appendsFindingsOnceAndReadsNewestFirst() {
        var older = finding(SW1, NOW);
        var newer = finding(AP1, NOW.plusSeconds(60));

        assertThat(persistence.appendFinding(older)).isTrue();
        assertThat(persistence.appendFinding(older)).isFalse();
        assertThat(persistence.appendFinding(newer)).isTrue();

        var stored = persistence.findings(10);
        assertThat(stored).extracting(Finding::findingId).containsExactly(newer.findingId(), older.findingId());
        assertThat(stored.get(0)).isEqualTo(newer);
    }

    private static Finding finding(String device, Instant detectedAt) {
        return Finding.builder()
                .type(FindingType.SINGLE_POINT_OF_FAILURE)
                .severity(Severity.CRITICAL)
                .riskScore(90)
                .affectedDevices(List.of(device))
                .affectedLinks(List.of())
                .description(device + " is a single point of failure")
                .recommendation("Implement redundancy")
                .graphVersion(2)
                .detectedAt(detectedAt)
                .build();
    }
}
