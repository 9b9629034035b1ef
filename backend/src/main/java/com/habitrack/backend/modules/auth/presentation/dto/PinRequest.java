package com.habitrack.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record PinRequest(
        @NotNull @Positive Long userId,
        @NotBlank String pin
) {
}
