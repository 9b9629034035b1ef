package com.habitrack.backend.modules.auth.presentation.dto;

public record ResetPasswordRequest(Long userId, String email, String code, String newSecret) {
}
