package com.habitrack.backend.modules.admin.presentation.dto;

public record SetPasswordRequest(String password) {
}
