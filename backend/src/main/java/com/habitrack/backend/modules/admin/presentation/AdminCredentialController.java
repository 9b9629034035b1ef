package com.habitrack.backend.modules.admin.presentation;

import com.habitrack.backend.global.security.SecurityUtils;
import com.habitrack.backend.modules.admin.application.AdminCredentialService;
import com.habitrack.backend.modules.admin.presentation.dto.SetPasswordRequest;
import com.habitrack.backend.modules.admin.presentation.dto.SetPinRequest;
import com.habitrack.backend.modules.kiosk.application.NetworkTrustClassifier;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users/{userId}")
public class AdminCredentialController {

    private final AdminCredentialService adminCredentialService;
    private final NetworkTrustClassifier networkTrustClassifier;

    public AdminCredentialController(
            AdminCredentialService adminCredentialService,
            NetworkTrustClassifier networkTrustClassifier
    ) {
        this.adminCredentialService = adminCredentialService;
        this.networkTrustClassifier = networkTrustClassifier;
    }

    @PutMapping("/password")
    public ResponseEntity<Void> setPassword(@PathVariable("userId") Long userId,
                                            @RequestBody SetPasswordRequest request,
                                            HttpServletRequest httpRequest) {
        adminCredentialService.setPassword(SecurityUtils.getCurrentUserId(), userId, request.password(),
                networkTrustClassifier.describe(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/pin")
    public ResponseEntity<Void> setPin(@PathVariable("userId") Long userId,
                                       @RequestBody SetPinRequest request,
                                       HttpServletRequest httpRequest) {
        adminCredentialService.setPin(SecurityUtils.getCurrentUserId(), userId, request.pin(),
                networkTrustClassifier.describe(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
