package com.habitrack.backend.modules.permission.presentation.dto;

public record PermissionRefreshResponse(int rowsLoaded) {
}
