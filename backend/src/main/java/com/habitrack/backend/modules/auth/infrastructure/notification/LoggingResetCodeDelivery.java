package com.habitrack.backend.modules.auth.infrastructure.notification;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.application.ResetCodeDelivery;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivery used until a mail channel is wired in. The code itself is never written out.
 */
@Component
public class LoggingResetCodeDelivery implements ResetCodeDelivery {

    private static final Logger log = LoggerFactory.getLogger(LoggingResetCodeDelivery.class);

    @Override
    public void deliver(HouseholdUser user, String code, OffsetDateTime expiresAt) {
        log.info("Password reset code issued for user {} (expires {}); no delivery channel configured",
                user.getId(), expiresAt);
    }
}
