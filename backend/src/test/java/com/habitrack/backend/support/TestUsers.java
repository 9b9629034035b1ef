package com.habitrack.backend.support;

import com.habitrack.backend.modules.auth.domain.HouseholdRole;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;

public final class TestUsers {

    private TestUsers() {
    }

    public static HouseholdUser user(long id, HouseholdRole role) {
        HouseholdUser user = new HouseholdUser();
        user.setId(id);
        user.setDisplayName("User " + id);
        user.setEmail("user" + id + "@example.com");
        user.setRole(role);
        user.setActive(true);
        return user;
    }

    public static HouseholdUser admin(long id) {
        return user(id, HouseholdRole.ADMIN);
    }

    public static HouseholdUser member(long id) {
        return user(id, HouseholdRole.MEMBER);
    }
}
