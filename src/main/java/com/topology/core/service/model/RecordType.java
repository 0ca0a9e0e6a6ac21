package com.topology.core.service.model;

public enum RecordType {
    DEVICE,
    LINK
}
