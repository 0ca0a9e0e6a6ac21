package com.topology.core.service.probe;

import com.topology.core.service.model.SourceKind;

/**
 * Discovery techniques a round can select.
 */
public enum ProbeKind {
    LLDP_LISTENER(SourceKind.PASSIVE_LISTENER),
    CDP_LISTENER(SourceKind.PASSIVE_LISTENER),
    MNDP_LISTENER(SourceKind.PASSIVE_LISTENER),
    SNMP_QUERY(SourceKind.ACTIVE_QUERY),
    CISCO_CLI(SourceKind.ACTIVE_QUERY),
    ROUTEROS_API(SourceKind.VENDOR_API);

    private final SourceKind sourceKind;

    ProbeKind(SourceKind sourceKind) {
        this.sourceKind = sourceKind;
    }

    public SourceKind sourceKind() {
        return sourceKind;
    }

    /**
     * Passive kinds listen on a local interface; all others query a host.
     */
    public boolean isPassive() {
        return sourceKind == SourceKind.PASSIVE_LISTENER;
    }

    public String probeId() {
        return name().toLowerCase().replace('_', '-');
    }

    /**
     * Parses a configured probe name, accepting either enum or id spelling.
     */
    public static ProbeKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Probe kind must not be blank");
        }
        var normalized = value.trim().toUpperCase().replace('-', '_');
        try {
            return ProbeKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown probe kind: " + value, e);
        }
    }
}
