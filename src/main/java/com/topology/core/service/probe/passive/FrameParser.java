package com.topology.core.service.probe.passive;

import java.util.Optional;

/**
 * Decodes raw link-layer frames into neighbour announcements.
 */
public interface FrameParser {

    /**
     * Protocol label written into records, e.g. "lldp".
     */
    String protocol();

    /**
     * Capture filter selecting this protocol's frames (BPF syntax).
     */
    String captureFilter();

    /**
     * @return the announcement, or empty if the frame is not of this protocol
     * @throws MalformedFrameException if the frame is of this protocol but cannot be decoded
     */
    Optional<NeighborAdvertisement> parse(byte[] frame) throws MalformedFrameException;
}
