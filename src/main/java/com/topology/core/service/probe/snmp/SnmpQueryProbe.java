package com.topology.core.service.probe.snmp;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.MacAddresses;
import com.topology.core.service.model.ObservationFields;
import com.topology.core.service.probe.AbstractProbe;
import com.topology.core.service.probe.ProbeDeadline;
import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import com.topology.core.service.probe.VendorFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticated SNMP query of a single agent.
 *
 * Reads the system group and LLDP local chassis id for the agent itself,
 * the LLDP remote table for PHYSICAL neighbours and the ARP table for
 * address bindings, which become INFERRED links.
 */
@Slf4j
@Component
public class SnmpQueryProbe extends AbstractProbe {

    static final double AGENT_CONFIDENCE = 0.9;
    static final double NEIGHBOR_CONFIDENCE = 0.8;
    static final double ARP_CONFIDENCE = 0.7;

    private final SnmpClient snmpClient;

    public SnmpQueryProbe(SnmpClient snmpClient, Clock clock) {
        super(clock);
        this.snmpClient = snmpClient;
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.SNMP_QUERY;
    }

    @Override
    protected void collect(ProbeTarget target, ProbeDeadline deadline,
                           List<DiscoveryRecord> collector) throws ProbeException {
        try (var session = snmpClient.open(target, deadline.remaining())) {
            deadline.checkpoint();
            var system = session.get(List.of(
                    SnmpOids.SYS_DESCR, SnmpOids.SYS_OBJECT_ID, SnmpOids.SYS_NAME, SnmpOids.SYS_LOCATION,
                    SnmpOids.LLDP_LOC_CHASSIS_ID_SUBTYPE, SnmpOids.LLDP_LOC_CHASSIS_ID));
            if (!system.containsKey(SnmpOids.SYS_DESCR) && !system.containsKey(SnmpOids.SYS_NAME)) {
                throw ProbeException.malformed("Agent " + target.label() + " returned no system group");
            }

            deadline.checkpoint();
            var agentMac = localChassisMac(system).or(() -> firstInterfaceMac(session, target));
            var agent = new AgentIdentity(agentMac.orElse(target.mac()), target);
            collector.add(agentRecord(target, agent, system));

            deadline.checkpoint();
            collectLldpNeighbours(session, target, agent, collector);

            deadline.checkpoint();
            collectArpEntries(session, target, agent, collector);
        }
    }

    // ==================== Agent ====================

    private Optional<String> localChassisMac(Map<String, SnmpVarBind> system) {
        var subtype = system.get(SnmpOids.LLDP_LOC_CHASSIS_ID_SUBTYPE);
        var chassis = system.get(SnmpOids.LLDP_LOC_CHASSIS_ID);
        if (subtype == null || chassis == null || !SnmpOids.CHASSIS_SUBTYPE_MAC.equals(subtype.text())) {
            return Optional.empty();
        }
        return MacAddresses.normalize(chassis.hex());
    }

    private Optional<String> firstInterfaceMac(SnmpClient.SnmpSession session, ProbeTarget target) {
        try {
            return session.walk(SnmpOids.IF_PHYS_ADDRESS).stream()
                    .map(row -> MacAddresses.normalize(row.hex()))
                    .flatMap(Optional::stream)
                    .findFirst();
        } catch (ProbeException e) {
            log.debug("ifPhysAddress walk failed on {}: {}", target.label(), e.getMessage());
            return Optional.empty();
        }
    }

    private DiscoveryRecord agentRecord(ProbeTarget target, AgentIdentity agent, Map<String, SnmpVarBind> system) {
        var payload = new HashMap<String, String>();
        agent.putInto(payload, "");
        var description = text(system, SnmpOids.SYS_DESCR);
        putIfPresent(payload, ObservationFields.HOSTNAME, text(system, SnmpOids.SYS_NAME));
        putIfPresent(payload, ObservationFields.DESCRIPTION, description);
        putIfPresent(payload, ObservationFields.LOCATION, text(system, SnmpOids.SYS_LOCATION));
        VendorFingerprint.vendorFromEnterpriseOid(text(system, SnmpOids.SYS_OBJECT_ID))
                .or(() -> VendorFingerprint.vendorFromDescription(description))
                .ifPresent(vendor -> payload.put(ObservationFields.VENDOR, vendor));
        VendorFingerprint.deviceTypeFromDescription(description)
                .ifPresent(type -> payload.put(ObservationFields.DEVICE_TYPE, type));
        return DiscoveryRecord.device(id(), sourceKind(), target.label(), clock.instant(), AGENT_CONFIDENCE, payload);
    }

    // ==================== LLDP Remote Table ====================

    private void collectLldpNeighbours(SnmpClient.SnmpSession session, ProbeTarget target, AgentIdentity agent,
                                       List<DiscoveryRecord> collector) throws ProbeException {
        var rows = new LinkedHashMap<String, Map<String, SnmpVarBind>>();
        for (var binding : session.walk(SnmpOids.LLDP_REM_ENTRY)) {
            var column = columnOf(binding);
            if (column == null) continue;
            rows.computeIfAbsent(column.index(), k -> new HashMap<>()).put(column.columnOid(), binding);
        }

        int dropped = 0;
        for (var row : rows.values()) {
            var neighbour = neighbourPayload(row);
            if (neighbour.isEmpty()) {
                dropped++;
                continue;
            }
            var now = clock.instant();
            collector.add(DiscoveryRecord.device(id(), sourceKind(), target.label(), now,
                    NEIGHBOR_CONFIDENCE, neighbour));
            collector.add(DiscoveryRecord.link(id(), sourceKind(), target.label(), now,
                    NEIGHBOR_CONFIDENCE, linkPayload(agent, neighbour, LinkType.PHYSICAL, portOf(row))));
        }
        if (dropped > 0) {
            log.warn("Dropped {} LLDP remote rows without a usable chassis id on {}", dropped, target.label());
        }
    }

    private Map<String, String> neighbourPayload(Map<String, SnmpVarBind> row) {
        var payload = new HashMap<String, String>();
        var subtype = row.get(SnmpOids.LLDP_REM_CHASSIS_ID_SUBTYPE);
        var chassis = row.get(SnmpOids.LLDP_REM_CHASSIS_ID);
        if (chassis == null) {
            return payload;
        }
        if (subtype != null && SnmpOids.CHASSIS_SUBTYPE_MAC.equals(subtype.text())) {
            MacAddresses.normalize(chassis.hex()).ifPresent(mac -> payload.put(ObservationFields.MAC, mac));
        } else {
            payload.put(ObservationFields.STABLE_ID, "lldp:" + chassis.text());
        }
        if (payload.isEmpty()) {
            return payload;
        }
        var description = text(row, SnmpOids.LLDP_REM_SYS_DESC);
        putIfPresent(payload, ObservationFields.HOSTNAME, text(row, SnmpOids.LLDP_REM_SYS_NAME));
        putIfPresent(payload, ObservationFields.DESCRIPTION, description);
        VendorFingerprint.vendorFromDescription(description)
                .ifPresent(vendor -> payload.put(ObservationFields.VENDOR, vendor));
        return payload;
    }

    private String portOf(Map<String, SnmpVarBind> row) {
        return text(row, SnmpOids.LLDP_REM_PORT_ID);
    }

    private RowColumn columnOf(SnmpVarBind binding) {
        var suffix = binding.indexBelow(SnmpOids.LLDP_REM_ENTRY);
        if (suffix == null) return null;
        int dot = suffix.indexOf('.');
        if (dot < 0) return null;
        return new RowColumn(SnmpOids.LLDP_REM_ENTRY + "." + suffix.substring(0, dot), suffix.substring(dot + 1));
    }

    // ==================== ARP Table ====================

    private void collectArpEntries(SnmpClient.SnmpSession session, ProbeTarget target, AgentIdentity agent,
                                   List<DiscoveryRecord> collector) throws ProbeException {
        int dropped = 0;
        for (var binding : session.walk(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS)) {
            var index = binding.indexBelow(SnmpOids.IP_NET_TO_MEDIA_PHYS_ADDRESS);
            var ip = index == null ? null : ipFromArpIndex(index);
            var mac = MacAddresses.normalize(binding.hex());
            if (ip == null || mac.isEmpty()) {
                dropped++;
                continue;
            }
            if (mac.get().equals(agent.mac())) {
                continue;
            }
            var host = new HashMap<String, String>();
            host.put(ObservationFields.MAC, mac.get());
            host.put(ObservationFields.IP, ip);
            var now = clock.instant();
            collector.add(DiscoveryRecord.device(id(), sourceKind(), target.label(), now, ARP_CONFIDENCE, host));
            collector.add(DiscoveryRecord.link(id(), sourceKind(), target.label(), now, ARP_CONFIDENCE,
                    linkPayload(agent, host, LinkType.INFERRED, null)));
        }
        if (dropped > 0) {
            log.warn("Dropped {} unparseable ARP rows on {}", dropped, target.label());
        }
    }

    /**
     * ipNetToMediaTable is indexed by ifIndex followed by the four address octets.
     */
    static String ipFromArpIndex(String index) {
        var parts = index.split("\\.");
        if (parts.length != 5) {
            return null;
        }
        for (int i = 1; i < 5; i++) {
            try {
                int octet = Integer.parseInt(parts[i]);
                if (octet < 0 || octet > 255) return null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return String.join(".", parts[1], parts[2], parts[3], parts[4]);
    }

    // ==================== Helpers ====================

    private Map<String, String> linkPayload(AgentIdentity agent, Map<String, String> neighbour,
                                            LinkType linkType, String remotePort) {
        var payload = new HashMap<String, String>();
        payload.put(ObservationFields.LINK_TYPE, linkType.name());
        agent.putInto(payload, ObservationFields.ENDPOINT_A);
        for (var field : List.of(ObservationFields.MAC, ObservationFields.IP, ObservationFields.STABLE_ID)) {
            putIfPresent(payload, ObservationFields.endpointB(field), neighbour.get(field));
        }
        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.PORT), remotePort);
        return payload;
    }

    private static String text(Map<String, SnmpVarBind> values, String oid) {
        var binding = values.get(oid);
        if (binding == null || binding.text() == null || binding.text().isBlank()) {
            return null;
        }
        return binding.text().trim();
    }

    private static void putIfPresent(Map<String, String> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value);
        }
    }

    private record RowColumn(String columnOid, String index) {
    }

    /**
     * How the queried agent identifies itself in records.
     */
    private record AgentIdentity(String mac, ProbeTarget target) {

        void putInto(Map<String, String> payload, String prefix) {
            putIfPresent(payload, prefix + ObservationFields.MAC, mac);
            if (target.isAddressLiteral()) {
                payload.put(prefix + ObservationFields.IP, target.host());
            } else if (target.host() != null) {
                payload.put(prefix + ObservationFields.STABLE_ID, target.host());
            }
        }
    }
}
