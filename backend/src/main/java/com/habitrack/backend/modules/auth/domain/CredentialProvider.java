package com.habitrack.backend.modules.auth.domain;

public enum CredentialProvider {
    PASSWORD,
    KIOSK_PIN
}
