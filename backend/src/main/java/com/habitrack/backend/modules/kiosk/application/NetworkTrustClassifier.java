package com.habitrack.backend.modules.kiosk.application;

import java.net.InetAddress;
import java.util.List;
import java.util.Optional;

import com.habitrack.backend.global.web.RequestMetadata;
import com.habitrack.backend.modules.kiosk.domain.CidrRange;
import com.habitrack.backend.modules.kiosk.domain.IpLiteral;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Decides whether a request comes from the household network.
 * <p>
 * The socket peer is ground truth. {@code X-Forwarded-For} is only read when the peer itself is a
 * loopback address, i.e. a reverse proxy running on the same host.
 */
@Component
public class NetworkTrustClassifier {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private static final Logger log = LoggerFactory.getLogger(NetworkTrustClassifier.class);
    private static final int MAX_LOGGED_LENGTH = 64;

    private static final List<CidrRange> LOOPBACK_RANGES = List.of(
            CidrRange.parse("127.0.0.0/8"),
            CidrRange.parse("::1/128")
    );

    private static final List<CidrRange> LOCAL_RANGES = List.of(
            CidrRange.parse("127.0.0.0/8"),
            CidrRange.parse("::1/128"),
            CidrRange.parse("10.0.0.0/8"),
            CidrRange.parse("172.16.0.0/12"),
            CidrRange.parse("192.168.0.0/16"),
            CidrRange.parse("fe80::/10"),
            CidrRange.parse("fc00::/7")
    );

    public boolean isLocal(String ip) {
        Optional<InetAddress> address = IpLiteral.parse(ip);
        if (address.isEmpty()) {
            log.warn("Client address '{}' could not be parsed; treating it as non-local", printable(ip));
            return false;
        }
        return matchesAny(address.get(), LOCAL_RANGES);
    }

    public boolean isLoopback(String ip) {
        return IpLiteral.parse(ip)
                .map(address -> matchesAny(address, LOOPBACK_RANGES))
                .orElse(false);
    }

    public String resolveClientIp(HttpServletRequest request) {
        String direct = IpLiteral.normalize(request.getRemoteAddr());
        if (!isLoopback(direct)) {
            return direct;
        }
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (!StringUtils.hasText(forwarded)) {
            return direct;
        }
        String first = forwarded.split(",", 2)[0];
        Optional<InetAddress> parsed = IpLiteral.parse(first);
        if (parsed.isEmpty()) {
            log.warn("Ignoring unparseable {} entry '{}' from proxy {}", FORWARDED_FOR_HEADER, printable(first), direct);
            return direct;
        }
        return parsed.get().getHostAddress();
    }

    public boolean isLocalRequest(HttpServletRequest request) {
        return isLocal(resolveClientIp(request));
    }

    public RequestMetadata describe(HttpServletRequest request) {
        return new RequestMetadata(resolveClientIp(request), request.getHeader("User-Agent"));
    }

    private boolean matchesAny(InetAddress address, List<CidrRange> ranges) {
        for (CidrRange range : ranges) {
            if (range.contains(address)) {
                return true;
            }
        }
        return false;
    }

    private static String printable(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.replaceAll("[\\r\\n\\t]", "_");
        return cleaned.length() > MAX_LOGGED_LENGTH ? cleaned.substring(0, MAX_LOGGED_LENGTH) + "..." : cleaned;
    }
}
