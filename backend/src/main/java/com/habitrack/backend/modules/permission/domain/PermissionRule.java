package com.habitrack.backend.modules.permission.domain;

import java.time.OffsetDateTime;

import com.habitrack.backend.modules.auth.domain.HouseholdRole;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

@Entity
@Table(name = "permission_rule")
public class PermissionRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private HouseholdRole role;

    @Column(name = "action_pattern", nullable = false, length = 255)
    private String actionPattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "effect", nullable = false, length = 8)
    private RuleEffect effect;

    @Column(name = "local_only", nullable = false)
    private boolean localOnly;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public RoleRule toRule() {
        return new RoleRule(actionPattern, effect, localOnly);
    }

    public Long getId() {
        return id;
    }

    public HouseholdRole getRole() {
        return role;
    }

    public void setRole(HouseholdRole role) {
        this.role = role;
    }

    public String getActionPattern() {
        return actionPattern;
    }

    public void setActionPattern(String actionPattern) {
        this.actionPattern = actionPattern;
    }

    public RuleEffect getEffect() {
        return effect;
    }

    public void setEffect(RuleEffect effect) {
        this.effect = effect;
    }

    public boolean isLocalOnly() {
        return localOnly;
    }

    public void setLocalOnly(boolean localOnly) {
        this.localOnly = localOnly;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
