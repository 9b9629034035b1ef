package com.habitrack.backend.modules.auth.presentation;

import com.habitrack.backend.global.security.SessionCookieSupport;
import com.habitrack.backend.modules.auth.application.PinAuthService;
import com.habitrack.backend.modules.auth.application.PinAuthService.PinLogin;
import com.habitrack.backend.modules.auth.presentation.dto.AuthUserResponse;
import com.habitrack.backend.modules.auth.presentation.dto.PinRequest;
import com.habitrack.backend.modules.auth.presentation.dto.PinUsersResponse;
import com.habitrack.backend.modules.auth.presentation.dto.PinVerifyResponse;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Kiosk", description = "PIN login for devices on the household network")
@RestController
@RequestMapping("/auth/pin")
public class PinAuthController {

    private final PinAuthService pinAuthService;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final SessionCookieSupport sessionCookieSupport;

    public PinAuthController(
            PinAuthService pinAuthService,
            NetworkTrustClassifier networkTrustClassifier,
            SessionCookieSupport sessionCookieSupport
    ) {
        this.pinAuthService = pinAuthService;
        this.networkTrustClassifier = networkTrustClassifier;
        this.sessionCookieSupport = sessionCookieSupport;
    }

    @GetMapping("/users")
    public ResponseEntity<PinUsersResponse> users(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(new PinUsersResponse(
                pinAuthService.listPinUsers(networkTrustClassifier.describe(httpRequest)).stream()
                        .map(AuthUserResponse::from)
                        .toList()
        ));
    }

    @Operation(summary = "PIN login", description = "Opens a short-lived kiosk session.")
    @PostMapping("/login")
    public ResponseEntity<AuthUserResponse> login(@Valid @RequestBody PinRequest request,
                                                  HttpServletRequest httpRequest,
                                                  HttpServletResponse httpResponse) {
        PinLogin login = pinAuthService.login(request.userId(), request.pin(), networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, login.session());
        return ResponseEntity.ok(AuthUserResponse.from(login.user()));
    }

    @PostMapping("/verify")
    public ResponseEntity<PinVerifyResponse> verify(@Valid @RequestBody PinRequest request,
                                                    HttpServletRequest httpRequest) {
        boolean valid = pinAuthService.verify(request.userId(), request.pin(), networkTrustClassifier.describe(httpRequest));
        return ResponseEntity.ok(new PinVerifyResponse(valid));
    }
}
