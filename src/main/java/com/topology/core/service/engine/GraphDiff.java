package com.topology.core.service.engine;

import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.TopologyGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Differences between two snapshots.
 */
public record GraphDiff(
        long fromVersion,
        long toVersion,
        List<String> addedDevices,
        List<String> removedDevices,
        List<StatusChange> statusChanges,
        List<LinkKey> addedLinks,
        List<LinkKey> removedLinks,
        List<StateChange> stateChanges
) {

    public record StatusChange(String identityKey, DeviceStatus from, DeviceStatus to) {
    }

    public record StateChange(LinkKey key, LinkState from, LinkState to) {
    }

    public static GraphDiff between(TopologyGraph older, TopologyGraph newer) {
        var addedDevices = new ArrayList<String>();
        var removedDevices = new ArrayList<String>();
        var statusChanges = new ArrayList<StatusChange>();
        newer.devices().forEach((key, device) -> {
            var before = older.devices().get(key);
            if (before == null) {
                addedDevices.add(key);
            } else if (before.status() != device.status()) {
                statusChanges.add(new StatusChange(key, before.status(), device.status()));
            }
        });
        older.devices().keySet().stream()
                .filter(key -> !newer.devices().containsKey(key))
                .forEach(removedDevices::add);

        var addedLinks = new ArrayList<LinkKey>();
        var removedLinks = new ArrayList<LinkKey>();
        var stateChanges = new ArrayList<StateChange>();
        newer.links().forEach((key, link) -> {
            var before = older.links().get(key);
            if (before == null) {
                addedLinks.add(key);
            } else if (before.state() != link.state()) {
                stateChanges.add(new StateChange(key, before.state(), link.state()));
            }
        });
        older.links().keySet().stream()
                .filter(key -> !newer.links().containsKey(key))
                .forEach(removedLinks::add);

        return new GraphDiff(older.version(), newer.version(),
                List.copyOf(addedDevices), List.copyOf(removedDevices), List.copyOf(statusChanges),
                List.copyOf(addedLinks), List.copyOf(removedLinks), List.copyOf(stateChanges));
    }

    public boolean isEmpty() {
        return addedDevices.isEmpty() && removedDevices.isEmpty() && statusChanges.isEmpty()
                && addedLinks.isEmpty() && removedLinks.isEmpty() && stateChanges.isEmpty();
    }
}
