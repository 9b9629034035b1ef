package com.habitrack.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotNull @Positive Long userId,
        @NotBlank @Size(min = 8, max = 256) String secret
) {
}
