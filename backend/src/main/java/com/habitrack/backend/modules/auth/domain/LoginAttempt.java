package com.habitrack.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "login_attempt")
public class LoginAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "ip", length = 64)
    private String ip;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "attempted_at", nullable = false)
    private OffsetDateTime attemptedAt;

    protected LoginAttempt() {
    }

    public LoginAttempt(Long userId, String ip, boolean success, OffsetDateTime attemptedAt) {
        this.userId = userId;
        this.ip = ip;
        this.success = success;
        this.attemptedAt = attemptedAt;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public String getIp() {
        return ip;
    }

    public boolean isSuccess() {
        return success;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }
}
