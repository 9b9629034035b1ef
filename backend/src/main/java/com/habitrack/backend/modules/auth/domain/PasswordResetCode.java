package com.habitrack.backend.modules.auth.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * The single outstanding reset code of a user, stored as a SHA-256 digest.
 * <p>
 * {@code createdAt} marks the start of the guess window. Codes re-issued inside that window replace
 * the digest but keep the attempt count, so {@link #MAX_ATTEMPTS} caps guesses per window rather than
 * per code.
 */
@Entity
@Table(name = "password_reset_code")
public class PasswordResetCode {

    public static final int MAX_ATTEMPTS = 5;
    private static final int ATTEMPTS_CEILING = 255;

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "code_hash", nullable = false)
    private byte[] codeHash;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public byte[] getCodeHash() {
        return codeHash;
    }

    public void setCodeHash(byte[] codeHash) {
        this.codeHash = codeHash;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public void registerFailedAttempt() {
        if (attempts < ATTEMPTS_CEILING) {
            attempts++;
        }
    }

    public boolean isGuessWindowOpenAt(OffsetDateTime now, Duration window) {
        return createdAt != null && createdAt.plus(window).isAfter(now);
    }

    public boolean isUsableAt(OffsetDateTime now) {
        return attempts < MAX_ATTEMPTS && expiresAt.isAfter(now);
    }
}
