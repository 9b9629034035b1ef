package com.habitrack.backend.modules.admin.presentation;

import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.global.security.SessionCookieSupport;
import com.habitrack.backend.modules.admin.application.ImpersonationService;
import com.habitrack.backend.modules.admin.presentation.dto.ImpersonationStatusResponse;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Admin", description = "Impersonation")
@RestController
@RequestMapping("/admin/impersonate")
public class ImpersonationController {

    private final ImpersonationService impersonationService;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final SessionCookieSupport sessionCookieSupport;

    public ImpersonationController(
            ImpersonationService impersonationService,
            NetworkTrustClassifier networkTrustClassifier,
            SessionCookieSupport sessionCookieSupport
    ) {
        this.impersonationService = impersonationService;
        this.networkTrustClassifier = networkTrustClassifier;
        this.sessionCookieSupport = sessionCookieSupport;
    }

    @Operation(summary = "Start impersonating a user", description = "Replaces the session cookie; the admin session stays valid.")
    @PostMapping("/{userId}")
    public ResponseEntity<Void> start(@PathVariable("userId") Long userId,
                                      HttpServletRequest httpRequest,
                                      HttpServletResponse httpResponse) {
        UserSession session = impersonationService.start(SecurityUtils.getCurrentPrincipal(), userId,
                networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/stop")
    public ResponseEntity<Void> stop(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        UserSession session = impersonationService.stop(sessionCookieSupport.readSid(httpRequest).orElse(null),
                networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    public ResponseEntity<ImpersonationStatusResponse> status() {
        return ResponseEntity.ok(ImpersonationStatusResponse.from(
                impersonationService.status(SecurityUtils.getCurrentPrincipal())));
    }
}
