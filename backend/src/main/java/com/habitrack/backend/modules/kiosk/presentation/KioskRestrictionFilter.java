package com.habitrack.backend.modules.kiosk.presentation;

import java.io.IOException;
import java.util.List;

import com.habitrack.backend.global.error.ProblemResponseWriter;
import com.habitrack.backend.global.security.RequestPaths;
import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.global.security.SessionPrincipal;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Keeps kiosk sessions away from administration and credential changes, whatever their role.
 */
@Component
public class KioskRestrictionFilter extends OncePerRequestFilter {

    public static final String KIOSK_RESTRICTED = "KIOSK_RESTRICTED";

    static final List<String> RESTRICTED_PATTERNS = List.of(
            "/admin/**",
            "/auth/creds/change"
    );

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final ProblemResponseWriter problemResponseWriter;

    public KioskRestrictionFilter(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        boolean kioskSession = SecurityUtils.findCurrentPrincipal().map(SessionPrincipal::kiosk).orElse(false);
        if (kioskSession && isRestricted(RequestPaths.pathWithinApplication(request))) {
            problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, KIOSK_RESTRICTED,
                    "This action is not available from a kiosk session");
            return;
        }
        filterChain.doFilter(request, response);
    }

    boolean isRestricted(String path) {
        for (String pattern : RESTRICTED_PATTERNS) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }
}
