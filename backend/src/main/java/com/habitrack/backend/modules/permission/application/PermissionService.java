package com.habitrack.backend.modules.permission.application;

import java.util.List;

import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.modules.permission.application.PermissionEvaluator.PermissionDecision;
import com.habitrack.backend.modules.permission.domain.RoleRule;

import org.springframework.stereotype.Service;

@Service
public class PermissionService {

    private final PermissionCache permissionCache;

    public PermissionService(PermissionCache permissionCache) {
        this.permissionCache = permissionCache;
    }

    public List<RoleRule> rulesFor(SessionPrincipal principal) {
        return permissionCache.getRules(principal.role());
    }

    public PermissionDecision check(SessionPrincipal principal, String action, boolean localRequest) {
        return PermissionEvaluator.evaluate(action, permissionCache.getRules(principal.role()), localRequest);
    }
}
