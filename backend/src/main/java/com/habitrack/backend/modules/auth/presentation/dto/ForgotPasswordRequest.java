package com.habitrack.backend.modules.auth.presentation.dto;

public record ForgotPasswordRequest(Long userId, String email) {
}
