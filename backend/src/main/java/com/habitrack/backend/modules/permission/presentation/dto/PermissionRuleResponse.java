package com.habitrack.backend.modules.permission.presentation.dto;

import java.util.Locale;

import com.habitrack.backend.modules.permission.domain.RoleRule;

public record PermissionRuleResponse(String actionPattern, String effect, boolean localOnly) {

    public static PermissionRuleResponse from(RoleRule rule) {
        return new PermissionRuleResponse(rule.actionPattern(), rule.effect().name().toLowerCase(Locale.ROOT),
                rule.localOnly());
    }
}
