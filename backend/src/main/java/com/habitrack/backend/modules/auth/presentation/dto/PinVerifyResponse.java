package com.habitrack.backend.modules.auth.presentation.dto;

public record PinVerifyResponse(boolean valid) {
}
