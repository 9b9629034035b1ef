package com.habitrack.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.HouseholdUser;

/**
 * Hands a freshly issued reset code to whatever channel reaches the user.
 */
public interface ResetCodeDelivery {

    void deliver(HouseholdUser user, String code, OffsetDateTime expiresAt);
}
