package com.habitrack.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.habitrack.backend.modules.admin.application.ImpersonationService.ImpersonationStatus;
import com.habitrack.backend.modules.auth.presentation.dto.AuthUserResponse;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImpersonationStatusResponse(boolean impersonating, AuthUserResponse originalAdmin) {

    public static ImpersonationStatusResponse from(ImpersonationStatus status) {
        return new ImpersonationStatusResponse(
                status.impersonating(),
                status.originalAdmin().map(AuthUserResponse::from).orElse(null)
        );
    }
}
