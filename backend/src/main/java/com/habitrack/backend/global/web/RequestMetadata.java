package com.habitrack.backend.global.web;

/**
 * Who is calling, as far as the audit trail and the login-attempt log are concerned.
 */
public record RequestMetadata(String clientIp, String userAgent) {

    public static RequestMetadata unknown() {
        return new RequestMetadata(null, null);
    }
}
