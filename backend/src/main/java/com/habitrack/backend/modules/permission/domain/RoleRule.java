package com.habitrack.backend.modules.permission.domain;

import java.util.Objects;

/**
 * One in-memory permission rule. {@code actionPattern} may contain {@code *} wildcards.
 */
public record RoleRule(String actionPattern, RuleEffect effect, boolean localOnly) {

    public RoleRule {
        Objects.requireNonNull(actionPattern, "actionPattern is required");
        Objects.requireNonNull(effect, "effect is required");
    }

    public static RoleRule allow(String actionPattern) {
        return new RoleRule(actionPattern, RuleEffect.ALLOW, false);
    }

    public static RoleRule allowLocal(String actionPattern) {
        return new RoleRule(actionPattern, RuleEffect.ALLOW, true);
    }

    public static RoleRule deny(String actionPattern) {
        return new RoleRule(actionPattern, RuleEffect.DENY, false);
    }

    public int wildcardCount() {
        int count = 0;
        for (int i = 0; i < actionPattern.length(); i++) {
            if (actionPattern.charAt(i) == '*') {
                count++;
            }
        }
        return count;
    }
}
