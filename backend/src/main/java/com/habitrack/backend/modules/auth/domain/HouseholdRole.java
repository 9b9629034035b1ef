package com.habitrack.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Optional;

public enum HouseholdRole {
    ADMIN,
    MEMBER,
    KID,
    KIOSK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<HouseholdRole> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (HouseholdRole role : values()) {
            if (role.name().equalsIgnoreCase(code.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
