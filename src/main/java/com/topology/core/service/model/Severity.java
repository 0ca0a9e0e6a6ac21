package com.topology.core.service.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM
}
