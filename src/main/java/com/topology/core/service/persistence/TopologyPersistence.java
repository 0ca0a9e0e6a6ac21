package com.topology.core.service.persistence;

import com.topology.core.service.model.Device;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.Link;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.TopologyGraph;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of the topology, written after every committed round and read
 * once at startup.
 */
public interface TopologyPersistence {

    void saveDevice(Device device);

    void saveLink(Link link);

    void removeDevice(String identityKey);

    void removeLink(LinkKey key);

    /**
     * Records which snapshot version the saved devices and links correspond to.
     */
    void markVersion(long version, Instant publishedAt);

    /**
     * Rebuilds the last saved snapshot, if anything was ever saved.
     */
    Optional<TopologyGraph> loadGraphSnapshot();

    /**
     * Appends a finding unless one with the same id is already stored.
     *
     * @return true if the finding was new
     */
    boolean appendFinding(Finding finding);

    /**
     * Stored findings, most recent first.
     */
    List<Finding> findings(int limit);

    /**
     * Short name for logs and health output.
     */
    String backend();
}
