package com.habitrack.backend.global.security;

import java.util.Optional;

import com.habitrack.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<SessionPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof SessionPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static SessionPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "AUTH_REQUIRED", "Authentication required"));
    }

    public static Long getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
