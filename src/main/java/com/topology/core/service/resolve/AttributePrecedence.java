package com.topology.core.service.resolve;

import com.topology.core.service.model.AttributeValue;

import java.util.Comparator;

/**
 * Orders competing attribute values: higher confidence first, then the more
 * recent observation, then the stronger source kind.
 */
public final class AttributePrecedence {

    private static final Comparator<AttributeValue> ORDER = Comparator
            .comparingDouble(AttributeValue::confidence)
            .thenComparing(AttributeValue::observedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(value -> value.sourceKind().rank());

    private AttributePrecedence() {
    }

    /**
     * Returns true if {@code candidate} should replace {@code existing}.
     * A full tie keeps the existing value.
     */
    public static boolean supersedes(AttributeValue candidate, AttributeValue existing) {
        if (existing == null) {
            return true;
        }
        return ORDER.compare(candidate, existing) > 0;
    }

    /**
     * Picks the winning value of two, keeping {@code existing} on a tie.
     */
    public static AttributeValue pick(AttributeValue existing, AttributeValue candidate) {
        if (candidate == null) return existing;
        return supersedes(candidate, existing) ? candidate : existing;
    }
}
