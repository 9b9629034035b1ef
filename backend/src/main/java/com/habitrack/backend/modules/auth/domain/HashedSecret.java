package com.habitrack.backend.modules.auth.domain;

public record HashedSecret(byte[] salt, byte[] hash) {
}
