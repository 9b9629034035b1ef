package com.habitrack.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.habitrack.backend.global.security.SessionPrincipal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        boolean valid,
        Long userId,
        String displayName,
        String role,
        OffsetDateTime expiresAt,
        Boolean kiosk,
        Long impersonatedBy
) {

    public static final SessionResponse INVALID = new SessionResponse(false, null, null, null, null, null, null);

    public static SessionResponse from(SessionPrincipal principal) {
        return new SessionResponse(
                true,
                principal.userId(),
                principal.displayName(),
                principal.role().code(),
                principal.expiresAt(),
                principal.kiosk(),
                principal.impersonatedBy()
        );
    }
}
