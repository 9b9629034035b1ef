package com.habitrack.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthUserResponse(Long id, String displayName, String nickname, String role) {

    public static AuthUserResponse from(HouseholdUser user) {
        return new AuthUserResponse(user.getId(), user.getDisplayName(), user.getNickname(), user.getRole().code());
    }
}
