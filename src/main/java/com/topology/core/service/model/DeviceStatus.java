package com.topology.core.service.model;

/**
 * Operational status of a device in the topology.
 */
public enum DeviceStatus {
    UNKNOWN,
    ONLINE,
    WARNING,
    OFFLINE,
    MAINTENANCE;

    /**
     * Parses a status reported by a discovery source, falling back to ONLINE
     * since a device that answered is at least reachable.
     */
    public static DeviceStatus fromObservation(String value) {
        if (value == null || value.isBlank()) {
            return ONLINE;
        }
        return switch (value.trim().toLowerCase()) {
            case "warning", "degraded" -> WARNING;
            case "maintenance" -> MAINTENANCE;
            case "offline", "down" -> OFFLINE;
            default -> ONLINE;
        };
    }
}
