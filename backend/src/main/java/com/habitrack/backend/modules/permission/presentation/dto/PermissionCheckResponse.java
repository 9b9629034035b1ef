package com.habitrack.backend.modules.permission.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionCheckResponse(String action, boolean allowed, String matchedPattern) {
}
