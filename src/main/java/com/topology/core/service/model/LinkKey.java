package com.topology.core.service.model;

import java.util.Objects;

/**
 * Identity of a link: an unordered endpoint pair plus the link type.
 *
 * Endpoints are stored in canonical (lexicographic) order so that
 * {@code of(a, b, t)} and {@code of(b, a, t)} are equal.
 */
public record LinkKey(String endpointA, String endpointB, LinkType linkType) {

    public LinkKey {
        Objects.requireNonNull(endpointA, "endpointA");
        Objects.requireNonNull(endpointB, "endpointB");
        Objects.requireNonNull(linkType, "linkType");
        if (endpointA.compareTo(endpointB) > 0) {
            var swap = endpointA;
            endpointA = endpointB;
            endpointB = swap;
        }
    }

    public static LinkKey of(String first, String second, LinkType linkType) {
        return new LinkKey(first, second, linkType);
    }

    public boolean involves(String identityKey) {
        return endpointA.equals(identityKey) || endpointB.equals(identityKey);
    }

    public boolean isSelfLink() {
        return endpointA.equals(endpointB);
    }

    /**
     * Returns this key with {@code from} replaced by {@code to} on either side.
     */
    public LinkKey rekey(String from, String to) {
        var a = endpointA.equals(from) ? to : endpointA;
        var b = endpointB.equals(from) ? to : endpointB;
        return new LinkKey(a, b, linkType);
    }

    @Override
    public String toString() {
        return endpointA + " <-> " + endpointB + " [" + linkType + "]";
    }
}
