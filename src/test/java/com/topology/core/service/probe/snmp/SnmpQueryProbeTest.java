package com.topology.core.service.probe.snmp;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.ObservationFields;
import com.topology.core.service.model.RecordType;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SnmpQueryProbeTest {

    private static final String AGENT_MAC = "00:11:22:33:44:55";
    private static final ProbeTarget AGENT = ProbeTarget.host("10.0.0.1");

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private FakeAgent agent;

    @BeforeEach
    void setUp() {
        agent = new FakeAgent();
        agent.scalar(SnmpOids.SYS_DESCR, "Cisco IOS Software, Catalyst L3 Switch");
        agent.scalar(SnmpOids.SYS_OBJECT_ID, "1.3.6.1.4.1.9.1.1208");
        agent.scalar(SnmpOids.SYS_NAME, "core-sw");
        agent.scalar(SnmpOids.SYS_LOCATION, "DC1 row 4");
        agent.scalar(SnmpOids.LLDP_LOC_CHASSIS_ID_SUBTYPE, "4");
        agent.octets(SnmpOids.LLDP_LOC_CHASSIS_ID, AGENT_MAC);

        agent.row(SnmpOids.LLDP_REM_CHASSIS_ID_SUBTYPE + ".0.1.1", "4", null);
        agent.row(SnmpOids.LLDP_REM_CHASSIS_ID + ".0.1.1", null, "aa:bb:cc:dd:ee:ff");
        agent.row(SnmpOids.LLDP_REM_PORT_ID + ".0.1.1", "Gi0/1", null);
        agent.row(SnmpOids.LLDP_REM_SYS_NAME + ".0.1.1", "sw1", null);
        agent.row(SnmpOids.LLDP_REM_CHASSIS_ID_SUBTYPE + ".0.2.1", "7", null);
        agent.row(SnmpOids.LLDP_REM_CHASSIS_ID + ".0.2.1", "edge-ap", null);

        agent.row(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS + ".2.10.0.0.50", null, "de:ad:be:ef:00:01");
        agent.row(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS + ".2.10.0.0.1", null, AGENT_MAC);
        agent.row(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS + ".2.10.0.0.77", null, null);
    }

    @Test
    @DisplayName("Reads the agent, its LLDP neighbours and its ARP table")
    void collectsAgentNeighboursAndArp() {
        var result = probe().run(AGENT, Duration.ofSeconds(2));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.records()).hasSize(7);

        var self = result.records().get(0);
        assertThat(self.type()).isEqualTo(RecordType.DEVICE);
        assertThat(self.confidenceHint()).isEqualTo(SnmpQueryProbe.AGENT_CONFIDENCE);
        assertThat(self.field(ObservationFields.MAC)).isEqualTo(AGENT_MAC);
        assertThat(self.field(ObservationFields.IP)).isEqualTo("10.0.0.1");
        assertThat(self.field(ObservationFields.HOSTNAME)).isEqualTo("core-sw");
        assertThat(self.field(ObservationFields.LOCATION)).isEqualTo("DC1 row 4");
        assertThat(self.field(ObservationFields.VENDOR)).isEqualTo("Cisco");
        assertThat(self.field(ObservationFields.DEVICE_TYPE)).isEqualTo("switch");

        var physical = linksOfType(result.records(), "PHYSICAL");
        assertThat(physical).hasSize(2);
        assertThat(physical.get(0).field("a.mac")).isEqualTo(AGENT_MAC);
        assertThat(physical.get(0).field("b.mac")).isEqualTo("aa:bb:cc:dd:ee:ff");
        assertThat(physical.get(0).field("b.port")).isEqualTo("Gi0/1");
        assertThat(physical.get(1).field("b.stableId")).isEqualTo("lldp:edge-ap");

        var inferred = linksOfType(result.records(), "INFERRED");
        assertThat(inferred).singleElement()
                .satisfies(link -> {
                    assertThat(link.field("b.mac")).isEqualTo("de:ad:be:ef:00:01");
                    assertThat(link.field("b.ip")).isEqualTo("10.0.0.50");
                    assertThat(link.confidenceHint()).isEqualTo(SnmpQueryProbe.ARP_CONFIDENCE);
                });
    }

    @Test
    void failsWhenAgentReturnsNoSystemGroup() {
        var empty = new FakeAgent();

        var result = new SnmpQueryProbe((target, timeout) -> empty, clock).run(AGENT, Duration.ofSeconds(2));

        assertThat(result.error().type()).isEqualTo(ProbeErrorType.MALFORMED_RESPONSE);
        assertThat(result.records()).isEmpty();
    }

    @Test
    void reportsAuthenticationFailure() {
        SnmpClient rejecting = (target, timeout) -> {
            throw new ProbeException(ProbeErrorType.AUTH_FAILURE, "Unknown user name");
        };

        var result = new SnmpQueryProbe(rejecting, clock).run(AGENT, Duration.ofSeconds(2));

        assertThat(result.error().type()).isEqualTo(ProbeErrorType.AUTH_FAILURE);
        assertThat(result.error().isRetryable()).isFalse();
    }

    @Test
    @DisplayName("A walk that times out keeps the records gathered before it")
    void keepsRecordsCollectedBeforeTimeout() {
        agent.failWalk(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS,
                ProbeException.timeout("No response to GETBULK"));

        var result = probe().run(AGENT, Duration.ofSeconds(2));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().type()).isEqualTo(ProbeErrorType.TIMEOUT);
        assertThat(result.records()).hasSize(5);
        assertThat(agent.closed).isTrue();
    }

    @Test
    void parsesArpIndex() {
        assertThat(SnmpQueryProbe.ipFromArpIndex("3.192.168.1.20")).isEqualTo("192.168.1.20");
        assertThat(SnmpQueryProbe.ipFromArpIndex("3.192.168.1")).isNull();
        assertThat(SnmpQueryProbe.ipFromArpIndex("3.300.168.1.20")).isNull();
    }

    private SnmpQueryProbe probe() {
        return new SnmpQueryProbe((target, timeout) -> agent, clock);
    }

    private static List<DiscoveryRecord> linksOfType(List<DiscoveryRecord> records, String linkType) {
        return records.stream()
                .filter(record -> record.type() == RecordType.LINK)
                .filter(record -> linkType.equals(record.field(ObservationFields.LINK_TYPE)))
                .toList();
    }

    /**
     * In-memory agent answering GETs and walks from fixed bindings.
     */
    private static final class FakeAgent implements SnmpClient.SnmpSession {

        private final Map<String, SnmpVarBind> bindings = new LinkedHashMap<>();
        private final Map<String, ProbeException> failingWalks = new HashMap<>();
        private boolean closed;

        void scalar(String oid, String text) {
            bindings.put(oid, new SnmpVarBind(oid, text, null));
        }

        void octets(String oid, String hex) {
            bindings.put(oid, new SnmpVarBind(oid, hex, hex));
        }

        void row(String oid, String text, String hex) {
            bindings.put(oid, new SnmpVarBind(oid, text, hex));
        }

        void failWalk(String rootOid, ProbeException error) {
            failingWalks.put(rootOid, error);
        }

        @Override
        public Map<String, SnmpVarBind> get(List<String> oids) {
            var found = new HashMap<String, SnmpVarBind>();
            oids.stream().filter(bindings::containsKey).forEach(oid -> found.put(oid, bindings.get(oid)));
            return found;
        }

        @Override
        public List<SnmpVarBind> walk(String rootOid) throws ProbeException {
            if (failingWalks.containsKey(rootOid)) {
                throw failingWalks.get(rootOid);
            }
            return bindings.values().stream()
                    .filter(binding -> binding.oid().startsWith(rootOid + "."))
                    .toList();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
