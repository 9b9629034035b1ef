package com.habitrack.backend.modules.auth.domain;

import java.time.OffsetDateTime;

/**
 * Snapshot of a user's recent failed logins measured against the lockout policy.
 *
 * @param lockoutExpiresAt set only while locked
 */
public record LockoutStatus(
        boolean locked,
        int failedAttempts,
        int remainingAttempts,
        OffsetDateTime lockoutExpiresAt
) {

    public static LockoutStatus unlocked(int threshold) {
        return new LockoutStatus(false, 0, threshold, null);
    }
}
