package com.topology.core.service.events;

public enum ChangeType {
    DEVICE_ADDED,
    DEVICE_REMOVED,
    DEVICE_STATUS_CHANGED,
    LINK_ADDED,
    LINK_REMOVED,
    LINK_STATE_CHANGED,
    FINDING_RAISED
}
