package com.topology.core.service.discovery;

public enum PairStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED
}
