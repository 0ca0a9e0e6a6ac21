package com.topology.core.service.model;

public enum LinkState {
    UP,
    DOWN
}
