package com.habitrack.backend.global.security;

import java.time.Duration;
import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.UserSession;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the session cookie ({@code HttpOnly}, {@code SameSite=Lax}, path {@code /}).
 */
@Component
public class SessionCookieSupport {

    private final String cookieName;
    private final boolean secure;

    public SessionCookieSupport(
            @Value("${habitrack.session.cookie-name:habitrack_sid}") String cookieName,
            @Value("${habitrack.session.cookie-secure:false}") boolean secure
    ) {
        this.cookieName = cookieName;
        this.secure = secure;
    }

    public Optional<String> readSid(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }

    public void write(HttpServletResponse response, String sid, Duration maxAge) {
        response.addHeader(HttpHeaders.SET_COOKIE, build(sid, maxAge).toString());
    }

    /**
     * Cookie lifetime follows the session's remaining lifetime as of its last activity.
     */
    public void write(HttpServletResponse response, UserSession session) {
        Duration maxAge = Duration.between(session.getLastSeenAt(), session.getExpiresAt());
        write(response, session.getSid(), maxAge.isNegative() ? Duration.ZERO : maxAge);
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, build("", Duration.ZERO).toString());
    }

    public String getCookieName() {
        return cookieName;
    }

    private ResponseCookie build(String value, Duration maxAge) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
