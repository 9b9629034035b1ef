package com.habitrack.backend.modules.permission.presentation;

import com.habitrack.backend.global.error.ProblemException;
import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;
import com.habitrack.backend.modules.permission.application.PermissionCache;
import com.habitrack.backend.modules.permission.application.PermissionEvaluator.PermissionDecision;
import com.habitrack.backend.modules.permission.application.PermissionService;
import com.habitrack.backend.modules.permission.presentation.dto.MyPermissionsResponse;
import com.habitrack.backend.modules.permission.presentation.dto.PermissionCheckResponse;
import com.habitrack.backend.modules.permission.presentation.dto.PermissionRefreshResponse;
import com.habitrack.backend.modules.permission.presentation.dto.PermissionRuleResponse;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PermissionController {

    private final PermissionService permissionService;
    private final PermissionCache permissionCache;
    private final NetworkTrustClassifier networkTrustClassifier;

    public PermissionController(
            PermissionService permissionService,
            PermissionCache permissionCache,
            NetworkTrustClassifier networkTrustClassifier
    ) {
        this.permissionService = permissionService;
        this.permissionCache = permissionCache;
        this.networkTrustClassifier = networkTrustClassifier;
    }

    @GetMapping("/permissions/me")
    public ResponseEntity<MyPermissionsResponse> me(HttpServletRequest httpRequest) {
        SessionPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(new MyPermissionsResponse(
                principal.role().code(),
                networkTrustClassifier.isLocalRequest(httpRequest),
                permissionService.rulesFor(principal).stream().map(PermissionRuleResponse::from).toList()
        ));
    }

    @GetMapping("/permissions/check")
    public ResponseEntity<PermissionCheckResponse> check(@RequestParam(name = "action") String action,
                                                         HttpServletRequest httpRequest) {
        if (!StringUtils.hasText(action)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "action is required");
        }
        PermissionDecision decision = permissionService.check(SecurityUtils.getCurrentPrincipal(), action.trim(),
                networkTrustClassifier.isLocalRequest(httpRequest));
        String matched = decision.matchedRule() != null ? decision.matchedRule().actionPattern() : null;
        return ResponseEntity.ok(new PermissionCheckResponse(action.trim(), decision.allowed(), matched));
    }

    @PostMapping("/admin/permissions/refresh")
    public ResponseEntity<PermissionRefreshResponse> refresh() {
        return ResponseEntity.ok(new PermissionRefreshResponse(permissionCache.refresh()));
    }
}
