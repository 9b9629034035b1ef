package com.habitrack.backend.modules.permission.domain;

public enum RuleEffect {
    ALLOW,
    DENY
}
