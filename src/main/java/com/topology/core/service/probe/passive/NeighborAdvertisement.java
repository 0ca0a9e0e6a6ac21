package com.topology.core.service.probe.passive;

import lombok.Builder;

/**
 * A neighbour announcement decoded from an LLDP or CDP frame.
 *
 * @param sourceMac  source address of the frame (the sending port)
 * @param chassisMac chassis MAC when the sender advertises one
 * @param chassisId  textual chassis or device identifier otherwise
 */
@Builder(toBuilder = true)
public record NeighborAdvertisement(
        String protocol,
        String sourceMac,
        String chassisMac,
        String chassisId,
        String portId,
        String systemName,
        String systemDescription,
        String managementAddress,
        String platform,
        String softwareVersion,
        String deviceType
) {

    /**
     * MAC that identifies the neighbour device.
     */
    public String identityMac() {
        return chassisMac != null ? chassisMac : sourceMac;
    }

    /**
     * Key used to collapse repeated announcements within one listen window.
     */
    public String announcementKey() {
        return protocol + "|" + identityMac() + "|" + chassisId + "|" + portId;
    }
}
