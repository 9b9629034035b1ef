package com.habitrack.backend.modules.auth.presentation;

import java.util.Optional;

import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.global.security.SessionCookieSupport;
import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.modules.auth.application.AuthService;
import com.habitrack.backend.modules.auth.presentation.dto.SessionResponse;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SessionController {

    private final AuthService authService;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final SessionCookieSupport sessionCookieSupport;

    public SessionController(
            AuthService authService,
            NetworkTrustClassifier networkTrustClassifier,
            SessionCookieSupport sessionCookieSupport
    ) {
        this.authService = authService;
        this.networkTrustClassifier = networkTrustClassifier;
        this.sessionCookieSupport = sessionCookieSupport;
    }

    @GetMapping("/auth/session")
    public ResponseEntity<SessionResponse> session() {
        return SecurityUtils.findCurrentPrincipal()
                .map(principal -> ResponseEntity.ok(SessionResponse.from(principal)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(SessionResponse.INVALID));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        Optional<SessionPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        String sid = sessionCookieSupport.readSid(httpRequest).orElse(null);
        authService.logout(sid, principal.map(SessionPrincipal::userId).orElse(null),
                networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.clear(httpResponse);
        return ResponseEntity.noContent().build();
    }
}
