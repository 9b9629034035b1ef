package com.habitrack.backend.modules.kiosk.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.InetAddress;

import org.junit.jupiter.api.Test;

class CidrRangeTest {

    @Test
    void matchesOnNonByteAlignedPrefix() {
        CidrRange range = CidrRange.parse("172.16.0.0/12");

        assertThat(range.contains(address("172.16.0.1"))).isTrue();
        assertThat(range.contains(address("172.31.255.255"))).isTrue();
        assertThat(range.contains(address("172.32.0.1"))).isFalse();
        assertThat(range.contains(address("172.15.255.255"))).isFalse();
    }

    @Test
    void familiesNeverMatchEachOther() {
        assertThat(CidrRange.parse("::1/128").contains(address("127.0.0.1"))).isFalse();
        assertThat(CidrRange.parse("0.0.0.0/0").contains(address("fe80::1"))).isFalse();
    }

    @Test
    void bareAddressIsSingleHost() {
        CidrRange range = CidrRange.parse("10.1.2.3");

        assertThat(range.getPrefixLength()).isEqualTo(32);
        assertThat(range.contains(address("10.1.2.3"))).isTrue();
        assertThat(range.contains(address("10.1.2.4"))).isFalse();
    }

    @Test
    void rejectsMalformedNotation() {
        assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/33")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CidrRange.parse("intranet/8")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CidrRange.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static InetAddress address(String literal) {
        return IpLiteral.parse(literal).orElseThrow();
    }
}
