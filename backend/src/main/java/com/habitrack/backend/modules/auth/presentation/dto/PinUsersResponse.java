package com.habitrack.backend.modules.auth.presentation.dto;

import java.util.List;

public record PinUsersResponse(List<AuthUserResponse> users) {
}
