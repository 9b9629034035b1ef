package com.habitrack.backend.modules.kiosk.domain;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Optional;

/**
 * Literal-only IP address parsing.
 * <p>
 * {@link InetAddress#getByName(String)} falls back to a DNS lookup for anything it cannot read as a
 * literal, so IPv4 text is decoded by hand and only strings that can only be IPv6 literals are handed
 * to the JDK. IPv4-mapped IPv6 input ({@code ::ffff:a.b.c.d}) comes back as an IPv4 address.
 */
public final class IpLiteral {

    /** Longest textual form, an IPv4-mapped IPv6 address. */
    static final int MAX_LITERAL_LENGTH = 45;

    private IpLiteral() {
    }

    public static Optional<InetAddress> parse(String raw) {
        String candidate = normalize(raw);
        if (candidate.isEmpty() || candidate.length() > MAX_LITERAL_LENGTH) {
            return Optional.empty();
        }
        if (candidate.indexOf(':') >= 0) {
            return parseIpv6(candidate);
        }
        return parseIpv4(candidate);
    }

    /**
     * Trims, lower-cases and strips {@code [..]} brackets and {@code %zone} suffixes.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String candidate = raw.trim();
        if (candidate.length() >= 2 && candidate.charAt(0) == '[' && candidate.charAt(candidate.length() - 1) == ']') {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        int zone = candidate.indexOf('%');
        if (zone >= 0) {
            candidate = candidate.substring(0, zone);
        }
        return candidate.toLowerCase(Locale.ROOT);
    }

    private static Optional<InetAddress> parseIpv4(String candidate) {
        String[] parts = candidate.split("\\.", -1);
        if (parts.length != 4) {
            return Optional.empty();
        }
        byte[] octets = new byte[4];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3) {
                return Optional.empty();
            }
            int value = 0;
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c < '0' || c > '9') {
                    return Optional.empty();
                }
                value = value * 10 + (c - '0');
            }
            if (value > 255) {
                return Optional.empty();
            }
            octets[i] = (byte) value;
        }
        try {
            return Optional.of(InetAddress.getByAddress(octets));
        } catch (UnknownHostException ex) {
            return Optional.empty();
        }
    }

    private static Optional<InetAddress> parseIpv6(String candidate) {
        // the JDK only skips name resolution when the text starts like a literal
        char first = candidate.charAt(0);
        if (first != ':' && Character.digit(first, 16) < 0) {
            return Optional.empty();
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (c != ':' && c != '.' && Character.digit(c, 16) < 0) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(InetAddress.getByName(candidate));
        } catch (UnknownHostException ex) {
            return Optional.empty();
        }
    }
}
