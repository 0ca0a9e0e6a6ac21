package com.topology.core.service.model;

import java.time.Instant;

/**
 * A single attribute value together with where and when it was observed.
 */
public record AttributeValue(
        String value,
        double confidence,
        Instant observedAt,
        SourceKind sourceKind,
        String sourceProbe
) {
}
