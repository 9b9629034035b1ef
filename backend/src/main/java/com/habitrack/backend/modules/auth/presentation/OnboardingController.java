package com.habitrack.backend.modules.auth.presentation;

import com.habitrack.backend.global.security.SessionCookieSupport;
import com.habitrack.backend.modules.auth.application.OnboardingService;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.presentation.dto.OnboardSetPasswordRequest;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OnboardingController {

    private final OnboardingService onboardingService;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final SessionCookieSupport sessionCookieSupport;

    public OnboardingController(
            OnboardingService onboardingService,
            NetworkTrustClassifier networkTrustClassifier,
            SessionCookieSupport sessionCookieSupport
    ) {
        this.onboardingService = onboardingService;
        this.networkTrustClassifier = networkTrustClassifier;
        this.sessionCookieSupport = sessionCookieSupport;
    }

    @PostMapping("/auth/onboard/set-password")
    public ResponseEntity<Void> setPassword(@Valid @RequestBody OnboardSetPasswordRequest request,
                                            HttpServletRequest httpRequest,
                                            HttpServletResponse httpResponse) {
        UserSession session = onboardingService.setInitialPassword(request.token(), request.newPassword(),
                networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }
}
