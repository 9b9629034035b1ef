package com.habitrack.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangeCredentialRequest(
        @NotBlank String oldSecret,
        @NotBlank @Size(min = 8, max = 256) String newSecret
) {
}
