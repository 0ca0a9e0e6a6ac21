package com.topology.core.service.model;

public enum FindingType {
    SINGLE_POINT_OF_FAILURE("Single Point of Failure"),
    BOTTLENECK_LINK("Bottleneck Link"),
    RESOLVER_CONFLICT("Identity Conflict");

    private final String label;

    FindingType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
