package com.habitrack.backend.modules.auth.presentation.dto;

public record ForgotPasswordResponse(boolean ok) {

    public static final ForgotPasswordResponse OK = new ForgotPasswordResponse(true);
}
