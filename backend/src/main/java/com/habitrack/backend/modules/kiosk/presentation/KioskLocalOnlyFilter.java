package com.habitrack.backend.modules.kiosk.presentation;

import java.io.IOException;

import com.habitrack.backend.global.error.ProblemResponseWriter;
import com.habitrack.backend.global.security.RequestPaths;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Refuses PIN endpoints to anything outside the household network before the request reaches a
 * handler. The PIN service checks again on its own.
 */
@Component
public class KioskLocalOnlyFilter extends OncePerRequestFilter {

    public static final String KIOSK_LOCAL_ONLY = "KIOSK_LOCAL_ONLY";
    static final String PIN_PATH_PREFIX = "/auth/pin/";

    private static final Logger log = LoggerFactory.getLogger(KioskLocalOnlyFilter.class);

    private final NetworkTrustClassifier networkTrustClassifier;
    private final ProblemResponseWriter problemResponseWriter;

    public KioskLocalOnlyFilter(NetworkTrustClassifier networkTrustClassifier,
                                ProblemResponseWriter problemResponseWriter) {
        this.networkTrustClassifier = networkTrustClassifier;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String clientIp = networkTrustClassifier.resolveClientIp(request);
        if (!networkTrustClassifier.isLocal(clientIp)) {
            log.warn("Rejected kiosk request to {} from non-local address {}", request.getRequestURI(), clientIp);
            problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, KIOSK_LOCAL_ONLY,
                    "Kiosk login is only available on the local network");
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !RequestPaths.pathWithinApplication(request).startsWith(PIN_PATH_PREFIX);
    }
}
