package com.habitrack.backend.global.security;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.HouseholdRole;

/**
 * The authenticated caller as resolved from the session cookie.
 *
 * @param impersonatedBy admin user id when this is an impersonation session, otherwise {@code null}
 */
public record SessionPrincipal(
        Long userId,
        String displayName,
        HouseholdRole role,
        String sid,
        boolean kiosk,
        Long impersonatedBy,
        OffsetDateTime expiresAt
) {

    public boolean isImpersonating() {
        return impersonatedBy != null;
    }

    public boolean isAdmin() {
        return role == HouseholdRole.ADMIN;
    }
}
