package com.habitrack.backend.modules.kiosk.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.Inet4Address;
import java.util.Locale;

import org.junit.jupiter.api.Test;

class IpLiteralTest {

    @Test
    void normalizeStripsBracketsZoneAndCase() {
        assertThat(IpLiteral.normalize(" [FE80::1%eth0] ")).isEqualTo("fe80::1");
        assertThat(IpLiteral.normalize(null)).isEmpty();
    }

    @Test
    void ipv4MappedComesBackAsIpv4() {
        assertThat(IpLiteral.parse("::ffff:192.168.1.5")).get().isInstanceOf(Inet4Address.class);
    }

    @Test
    void hostnamesAndBrokenLiteralsAreNotResolved() {
        assertThat(IpLiteral.parse("localhost")).isEmpty();
        assertThat(IpLiteral.parse("example.com")).isEmpty();
        assertThat(IpLiteral.parse("256.1.1.1")).isEmpty();
        assertThat(IpLiteral.parse("1.2.3")).isEmpty();
        assertThat(IpLiteral.parse("")).isEmpty();
    }

    @Test
    void overlongInputIsRejectedWithoutParsing() {
        assertThat(IpLiteral.parse("1".repeat(46))).isEmpty();
        assertThat(IpLiteral.parse("::ffff:255.255.255.255")).isPresent();
    }

    @Test
    void normalizeIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertThat(IpLiteral.normalize("FE80::1%LINK")).isEqualTo("fe80::1");
            assertThat(IpLiteral.normalize("::FFFF:A00:1")).isEqualTo("::ffff:a00:1");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
