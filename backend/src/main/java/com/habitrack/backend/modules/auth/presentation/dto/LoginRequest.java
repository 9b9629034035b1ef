package com.habitrack.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Either {@code userId} or {@code email} identifies the account.
 */
public record LoginRequest(
        Long userId,
        String email,
        @NotBlank String secret
) {
}
