package com.habitrack.backend.modules.auth.presentation;

import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.global.security.SessionCookieSupport;
import com.habitrack.backend.modules.auth.application.AuthService;
import com.habitrack.backend.modules.auth.application.AuthService.LoginResult;
import com.habitrack.backend.modules.auth.application.OnboardTokenService;
import com.habitrack.backend.modules.auth.application.PasswordResetService;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.presentation.dto.ChangeCredentialRequest;
import com.habitrack.backend.modules.auth.presentation.dto.FirstLoginRequiredResponse;
import com.habitrack.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.habitrack.backend.modules.auth.presentation.dto.ForgotPasswordResponse;
import com.habitrack.backend.modules.auth.presentation.dto.LoginRequest;
import com.habitrack.backend.modules.auth.presentation.dto.RegisterRequest;
import com.habitrack.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Auth", description = "Password credentials")
@RestController
@RequestMapping("/auth/creds")
public class CredentialAuthController {

    private final AuthService authService;
    private final PasswordResetService passwordResetService;
    private final OnboardTokenService onboardTokenService;
    private final NetworkTrustClassifier networkTrustClassifier;
    private final SessionCookieSupport sessionCookieSupport;

    public CredentialAuthController(
            AuthService authService,
            PasswordResetService passwordResetService,
            OnboardTokenService onboardTokenService,
            NetworkTrustClassifier networkTrustClassifier,
            SessionCookieSupport sessionCookieSupport
    ) {
        this.authService = authService;
        this.passwordResetService = passwordResetService;
        this.onboardTokenService = onboardTokenService;
        this.networkTrustClassifier = networkTrustClassifier;
        this.sessionCookieSupport = sessionCookieSupport;
    }

    @Operation(summary = "Password login", description = "Opens a session, or answers 428 with an onboarding token on first login.")
    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request,
                                   HttpServletRequest httpRequest,
                                   HttpServletResponse httpResponse) {
        LoginResult result = authService.login(request.userId(), request.email(), request.secret(),
                networkTrustClassifier.describe(httpRequest));
        if (result.firstLoginRequired()) {
            return ResponseEntity.status(HttpStatus.PRECONDITION_REQUIRED)
                    .body(FirstLoginRequiredResponse.of(result.onboardToken(), onboardTokenService.getTtl().toSeconds()));
        }
        sessionCookieSupport.write(httpResponse, result.session());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/register")
    public ResponseEntity<Void> register(@Valid @RequestBody RegisterRequest request,
                                         HttpServletRequest httpRequest,
                                         HttpServletResponse httpResponse) {
        UserSession session = authService.register(request.userId(), request.secret(),
                networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/change")
    public ResponseEntity<Void> change(@Valid @RequestBody ChangeCredentialRequest request,
                                       HttpServletRequest httpRequest,
                                       HttpServletResponse httpResponse) {
        UserSession session = authService.changeCredential(SecurityUtils.getCurrentPrincipal(),
                request.oldSecret(), request.newSecret(), networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request a reset code", description = "Always answers ok, whether or not the account exists.")
    @PostMapping("/forgot")
    public ResponseEntity<ForgotPasswordResponse> forgot(@RequestBody ForgotPasswordRequest request,
                                                         HttpServletRequest httpRequest) {
        passwordResetService.requestReset(request.userId(), request.email(), networkTrustClassifier.describe(httpRequest));
        return ResponseEntity.ok(ForgotPasswordResponse.OK);
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> reset(@RequestBody ResetPasswordRequest request,
                                      HttpServletRequest httpRequest,
                                      HttpServletResponse httpResponse) {
        UserSession session = passwordResetService.reset(request.userId(), request.email(), request.code(),
                request.newSecret(), networkTrustClassifier.describe(httpRequest));
        sessionCookieSupport.write(httpResponse, session);
        return ResponseEntity.noContent().build();
    }
}
