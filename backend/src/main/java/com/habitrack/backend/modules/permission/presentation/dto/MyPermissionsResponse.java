package com.habitrack.backend.modules.permission.presentation.dto;

import java.util.List;

public record MyPermissionsResponse(String role, boolean localRequest, List<PermissionRuleResponse> rules) {
}
