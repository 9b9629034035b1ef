package com.habitrack.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OnboardSetPasswordRequest(
        @NotBlank String token,
        @NotBlank @Size(min = 8, max = 256) String newPassword
) {
}
