package com.habitrack.backend.modules.auth.domain;

import java.time.Duration;
import java.util.Objects;

public record SessionRequest(
        Long userId,
        HouseholdRole role,
        Duration ttl,
        boolean kiosk,
        Long impersonatedBy,
        String clientIp
) {

    public SessionRequest {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    public static SessionRequest regular(Long userId, HouseholdRole role, Duration ttl, String clientIp) {
        return new SessionRequest(userId, role, ttl, false, null, clientIp);
    }
}
