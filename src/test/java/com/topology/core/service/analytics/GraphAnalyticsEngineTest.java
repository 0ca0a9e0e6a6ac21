package com.topology.core.service.analytics;

import com.topology.core.service.config.AnalyticsConfig;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.FindingType;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.Severity;
import com.topology.core.service.model.TopologyGraph;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GraphAnalyticsEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private GraphAnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new GraphAnalyticsEngine(new AnalyticsConfig(), new MetricsConfig(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Metrics ====================

    @Test
    void emptyGraphHasNoMetrics() {
        var report = engine.analyze(TopologyGraph.empty());

        assertThat(report.nodeCount()).isZero();
        assertThat(report.linkCount()).isZero();
        assertThat(report.averageDegree()).isZero();
        assertThat(report.density()).isZero();
        assertThat(report.componentCount()).isZero();
        assertThat(report.diameter()).isNull();
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void singleDeviceIsConnected() {
        var report = engine.analyze(new GraphBuilder().device("a").build());

        assertThat(report.nodeCount()).isEqualTo(1);
        assertThat(report.componentCount()).isEqualTo(1);
        assertThat(report.diameter()).isZero();
        assertThat(report.betweenness()).containsEntry("a", 0.0);
    }

    @Test
    @DisplayName("A star network has its hub at full betweenness")
    void starMetrics() {
        var report = engine.analyze(star());

        assertThat(report.graphVersion()).isEqualTo(3);
        assertThat(report.analyzedAt()).isEqualTo(NOW);
        assertThat(report.nodeCount()).isEqualTo(5);
        assertThat(report.linkCount()).isEqualTo(4);
        assertThat(report.averageDegree()).isEqualTo(1.6);
        assertThat(report.density()).isCloseTo(0.4, within(1e-9));
        assertThat(report.degrees()).containsEntry("hub", 4).containsEntry("s1", 1);
        assertThat(report.degreeDistribution()).containsEntry(1, 4).containsEntry(4, 1);
        assertThat(report.diameter()).isEqualTo(2);
        assertThat(report.betweenness().get("hub")).isCloseTo(1.0, within(1e-9));
        assertThat(report.betweenness().get("s1")).isZero();
        assertThat(report.averageClustering()).isZero();
        assertThat(report.linkPathShare().values()).allSatisfy(share -> assertThat(share).isCloseTo(0.4, within(1e-9)));
    }

    @Test
    void disconnectedGraphHasNoDiameter() {
        var graph = new GraphBuilder()
                .link("a", "b")
                .link("c", "d")
                .build();

        var report = engine.analyze(graph);

        assertThat(report.componentCount()).isEqualTo(2);
        assertThat(report.largestComponentSize()).isEqualTo(2);
        assertThat(report.isConnected()).isFalse();
        assertThat(report.diameter()).isNull();
    }

    @Test
    void triangleIsFullyClustered() {
        var graph = new GraphBuilder().link("a", "b").link("b", "c").link("a", "c").build();

        var report = engine.analyze(graph);

        assertThat(report.averageClustering()).isCloseTo(1.0, within(1e-9));
        assertThat(report.density()).isCloseTo(1.0, within(1e-9));
        assertThat(report.findings()).isEmpty();
    }

    @Test
    @DisplayName("Offline devices and down links are left out of the analysis")
    void ignoresOfflineDevicesAndDownLinks() {
        var graph = new GraphBuilder()
                .link("a", "b")
                .link("b", "c")
                .offline("c")
                .downLink("a", "d")
                .build();

        var report = engine.analyze(graph);

        assertThat(report.nodeCount()).isEqualTo(3);
        assertThat(report.linkCount()).isEqualTo(1);
        assertThat(report.degrees()).doesNotContainKey("c");
    }

    // ==================== Findings ====================

    @Test
    @DisplayName("The hub of a star is a critical single point of failure")
    void starHubIsCriticalSinglePointOfFailure() {
        var findings = engine.analyze(star()).findings();

        var spof = findings.stream().filter(f -> f.type() == FindingType.SINGLE_POINT_OF_FAILURE).toList();
        assertThat(spof).singleElement().satisfies(finding -> {
            assertThat(finding.affectedDevices()).containsExactly("hub");
            assertThat(finding.riskScore()).isEqualTo(90);
            assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(finding.affectedLinks()).hasSize(4);
            assertThat(finding.description()).contains("disconnects 3 device(s)");
            assertThat(finding.graphVersion()).isEqualTo(3);
        });
        assertThat(findings.get(0)).isEqualTo(spof.get(0));
    }

    @Test
    void starSpokesAreBottlenecks() {
        var bottlenecks = engine.analyze(star()).findings().stream()
                .filter(f -> f.type() == FindingType.BOTTLENECK_LINK)
                .toList();

        assertThat(bottlenecks).hasSize(4).allSatisfy(finding -> {
            assertThat(finding.riskScore()).isEqualTo(15);
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.affectedDevices()).contains("hub");
            assertThat(finding.description()).contains("40%");
        });
    }

    @Test
    @DisplayName("A ring has no single point of failure and no link above the path-share threshold")
    void ringHasNoFindings() {
        var graph = new GraphBuilder()
                .link("r1", "r2").link("r2", "r3").link("r3", "r4")
                .link("r4", "r5").link("r5", "r6").link("r6", "r1")
                .build();

        var report = engine.analyze(graph);

        assertThat(report.linkPathShare().values()).allSatisfy(share -> assertThat(share).isCloseTo(0.3, within(1e-9)));
        assertThat(report.diameter()).isEqualTo(3);
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void chainMiddleIsArticulationPoint() {
        var graph = new GraphBuilder().link("a", "b").link("b", "c").build();

        var findings = engine.analyze(graph).findings();

        assertThat(findings).extracting(Finding::type).contains(FindingType.SINGLE_POINT_OF_FAILURE);
        assertThat(findings).filteredOn(f -> f.type() == FindingType.SINGLE_POINT_OF_FAILURE)
                .extracting(f -> f.affectedDevices().get(0))
                .containsExactly("b");
    }

    @Test
    @DisplayName("A wheel hub is not a cut vertex but removing it doubles the diameter")
    void wheelHubRaisesDiameterBeyondFactor() {
        var report = engine.analyze(wheel(8));

        assertThat(report.diameter()).isEqualTo(2);
        assertThat(report.findings()).filteredOn(f -> f.type() == FindingType.SINGLE_POINT_OF_FAILURE)
                .singleElement()
                .satisfies(finding -> {
                    assertThat(finding.affectedDevices()).containsExactly("hub");
                    assertThat(finding.affectedLinks()).hasSize(8);
                    assertThat(finding.description()).contains("raises the network diameter from 2 to 4 hops");
                });
    }

    @Test
    void diameterIncreaseWithinFactorIsNotAFinding() {
        var config = new AnalyticsConfig();
        config.setDiameterIncreaseFactor(2.5);
        var tolerant = new GraphAnalyticsEngine(config, new MetricsConfig(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));

        var findings = tolerant.analyze(wheel(8)).findings();

        assertThat(findings).noneMatch(f -> f.type() == FindingType.SINGLE_POINT_OF_FAILURE);
    }

    @Test
    void twoDevicesRaiseNoFindings() {
        var report = engine.analyze(new GraphBuilder().link("a", "b").build());

        assertThat(report.findings()).isEmpty();
    }

    @Test
    void findingIdsAreStableAcrossRuns() {
        var first = engine.analyze(star()).findings();
        var second = engine.analyze(star()).findings();

        assertThat(second).extracting(Finding::findingId)
                .containsExactlyElementsOf(first.stream().map(Finding::findingId).toList());
    }

    // ==================== Helpers ====================

    private static TopologyGraph star() {
        return new GraphBuilder()
                .link("hub", "s1")
                .link("hub", "s2")
                .link("hub", "s3")
                .link("hub", "s4")
                .build();
    }

    private static TopologyGraph wheel(int rimSize) {
        var builder = new GraphBuilder();
        for (int i = 1; i <= rimSize; i++) {
            builder.link("hub", "r" + i).link("r" + i, "r" + (i % rimSize + 1));
        }
        return builder.build();
    }

    private static final class GraphBuilder {

        private final Map<String, Device> devices = new HashMap<>();
        private final Map<LinkKey, Link> links = new LinkedHashMap<>();

        GraphBuilder device(String key) {
            devices.putIfAbsent(key, Device.builder()
                    .identityKey(key)
                    .status(DeviceStatus.ONLINE)
                    .firstSeen(NOW)
                    .lastSeen(NOW)
                    .build());
            return this;
        }

        GraphBuilder offline(String key) {
            device(key);
            devices.put(key, devices.get(key).withStatus(DeviceStatus.OFFLINE));
            return this;
        }

        GraphBuilder link(String a, String b) {
            return link(a, b, LinkState.UP);
        }

        GraphBuilder downLink(String a, String b) {
            return link(a, b, LinkState.DOWN);
        }

        private GraphBuilder link(String a, String b, LinkState state) {
            device(a);
            device(b);
            var key = LinkKey.of(a, b, LinkType.PHYSICAL);
            links.put(key, Link.builder()
                    .key(key)
                    .discoveredVia(Set.of("snmp-query"))
                    .firstSeen(NOW)
                    .lastSeen(NOW)
                    .state(state)
                    .build());
            return this;
        }

        TopologyGraph build() {
            return new TopologyGraph(3, NOW, devices, links);
        }
    }
}
