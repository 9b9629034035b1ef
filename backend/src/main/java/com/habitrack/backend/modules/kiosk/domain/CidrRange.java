package com.habitrack.backend.modules.kiosk.domain;

import java.net.InetAddress;
import java.util.Arrays;

/**
 * An address block in CIDR notation, matched bitwise against parsed addresses.
 */
public final class CidrRange {

    private final byte[] network;
    private final int prefixLength;
    private final String notation;

    private CidrRange(byte[] network, int prefixLength, String notation) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.notation = notation;
    }

    public static CidrRange parse(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new IllegalArgumentException("CIDR notation must not be blank");
        }
        String trimmed = notation.trim();
        int slash = trimmed.indexOf('/');
        String addressPart = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        InetAddress address = IpLiteral.parse(addressPart)
                .orElseThrow(() -> new IllegalArgumentException("Invalid CIDR address: " + notation));
        byte[] bytes = address.getAddress();
        int maxPrefix = bytes.length * 8;
        int prefix = maxPrefix;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid CIDR prefix: " + notation, ex);
            }
        }
        if (prefix < 0 || prefix > maxPrefix) {
            throw new IllegalArgumentException("CIDR prefix out of range: " + notation);
        }
        return new CidrRange(bytes, prefix, trimmed);
    }

    public boolean contains(InetAddress address) {
        if (address == null) {
            return false;
        }
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public byte[] getNetwork() {
        return Arrays.copyOf(network, network.length);
    }

    @Override
    public String toString() {
        return notation;
    }
}
