package com.habitrack.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import com.habitrack.backend.modules.auth.infrastructure.token.OnboardTokenKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Short-lived signed token that lets a user with {@code first_login_required} set a password
 * without holding a session.
 */
@Service
public class OnboardTokenService {

    static final String PURPOSE_CLAIM = "purpose";
    static final String PURPOSE_ONBOARD = "onboard";

    private final OnboardTokenKeyProvider keyProvider;
    private final Duration ttl;
    private final Clock clock;

    public OnboardTokenService(
            OnboardTokenKeyProvider keyProvider,
            @Value("${habitrack.onboard.token-ttl:PT10M}") Duration ttl,
            Clock clock
    ) {
        this.keyProvider = keyProvider;
        this.ttl = ttl;
        this.clock = clock;
    }

    public String issue(Long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(PURPOSE_CLAIM, PURPOSE_ONBOARD)
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    /**
     * @return the user id the token was issued for
     * @throws InvalidOnboardTokenException when the token is malformed, forged, expired or issued for another purpose
     */
    public Long parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidOnboardTokenException("Onboard token is missing", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!PURPOSE_ONBOARD.equals(claims.get(PURPOSE_CLAIM, String.class))) {
                throw new InvalidOnboardTokenException("Token was not issued for onboarding", null);
            }
            return Long.valueOf(claims.getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidOnboardTokenException("Invalid onboard token", e);
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    public static class InvalidOnboardTokenException extends RuntimeException {
        public InvalidOnboardTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
