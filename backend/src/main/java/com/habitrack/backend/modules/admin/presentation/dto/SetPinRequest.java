package com.habitrack.backend.modules.admin.presentation.dto;

public record SetPinRequest(String pin) {
}
