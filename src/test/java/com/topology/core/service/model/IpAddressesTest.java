package com.topology.core.service.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class IpAddressesTest {

    @Test
    void keepsIpv4Literals() {
        assertThat(IpAddresses.normalize(" 10.0.0.1 ")).contains("10.0.0.1");
        assertThat(IpAddresses.normalize("0.0.0.0")).isEmpty();
        assertThat(IpAddresses.normalize("256.1.1.1")).isEmpty();
    }

    @Test
    void canonicalizesIpv6Literals() {
        assertThat(IpAddresses.normalize("FE80::1")).contains("fe80:0:0:0:0:0:0:1");
        assertThat(IpAddresses.normalize("::ffff:10.0.0.1")).contains("10.0.0.1");
        assertThat(IpAddresses.normalize("2001:db8:0:0:0:0:0:1")).contains("2001:db8:0:0:0:0:0:1");
    }

    @ParameterizedTest
    @DisplayName("Strings that only look like addresses are rejected without a name lookup")
    @ValueSource(strings = {"1.2.3.4:161", "abc:def", "1:2:3:4:5:6:7:8:9", "1::2::3", ":1:2:3:4:5:6:7",
            "1:2:3:4:5:6:7:", "::1.2.3.4:5", "fe80::1%eth0", "::", "12345::1"})
    void rejectsNonLiterals(String value) {
        assertThat(IpAddresses.normalize(value)).isEmpty();
    }

    @Test
    void structuralCheckCountsEmbeddedIpv4AsTwoGroups() {
        assertThat(IpAddresses.isIpv6Literal("0:0:0:0:0:ffff:10.0.0.1")).isTrue();
        assertThat(IpAddresses.isIpv6Literal("0:0:0:0:0:0:ffff:10.0.0.1")).isFalse();
        assertThat(IpAddresses.isIpv6Literal("1:2:3:4:5:6:7::")).isTrue();
    }
}
