package com.habitrack.backend.modules.auth.presentation.dto;

public record FirstLoginRequiredResponse(String code, String onboardToken, long expiresIn) {

    public static final String CODE = "FIRST_LOGIN_REQUIRED";

    public static FirstLoginRequiredResponse of(String onboardToken, long expiresIn) {
        return new FirstLoginRequiredResponse(CODE, onboardToken, expiresIn);
    }
}
