package com.habitrack.backend.modules.audit.domain;

public enum AuditResult {
    OK,
    DENY,
    ERROR
}
