package com.topology.core.service.resolve;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.IpAddresses;
import com.topology.core.service.model.MacAddresses;
import com.topology.core.service.model.ObservationFields;

/**
 * Normalized identity candidates of one device, read from a record payload.
 *
 * @param mac      lower-case colon form, or null
 * @param ip       validated literal, or null
 * @param stableId vendor or protocol specific identifier, or null
 */
record ObservedIdentity(String mac, String ip, String stableId) {

    /**
     * Reads the identity fields under {@code prefix}; use an empty prefix for
     * device records and an endpoint prefix for link records.
     */
    static ObservedIdentity read(DiscoveryRecord record, String prefix) {
        var mac = MacAddresses.normalize(record.field(prefix + ObservationFields.MAC)).orElse(null);
        var ip = IpAddresses.normalize(record.field(prefix + ObservationFields.IP)).orElse(null);
        var stableId = record.field(prefix + ObservationFields.STABLE_ID);
        if (stableId != null && stableId.isBlank()) {
            stableId = null;
        }
        return new ObservedIdentity(mac, ip, stableId == null ? null : stableId.trim());
    }

    boolean isEmpty() {
        return mac == null && ip == null && stableId == null;
    }
}
