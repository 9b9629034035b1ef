package com.habitrack.backend.modules.permission.application;

import java.util.Comparator;
import java.util.List;

import com.habitrack.backend.modules.permission.domain.RoleRule;
import com.habitrack.backend.modules.permission.domain.RuleEffect;

import org.springframework.util.PatternMatchUtils;

/**
 * Resolves an action against an ordered rule list. Patterns are simple globs where {@code *} stands
 * for any run of characters.
 * <p>
 * A matching deny always wins. An allow marked local-only counts only for requests from the local
 * network. When several allows match, the most specific one (fewest wildcards, then longest pattern)
 * is reported. No match means deny.
 */
public final class PermissionEvaluator {

    private static final Comparator<RoleRule> SPECIFICITY = Comparator
            .comparingInt(RoleRule::wildcardCount)
            .thenComparingInt(rule -> -rule.actionPattern().length());

    private PermissionEvaluator() {
    }

    public static PermissionDecision evaluate(String action, List<RoleRule> rules, boolean localRequest) {
        if (action == null || action.isBlank() || rules == null || rules.isEmpty()) {
            return PermissionDecision.denied(null);
        }
        RoleRule bestAllow = null;
        for (RoleRule rule : rules) {
            if (!PatternMatchUtils.simpleMatch(rule.actionPattern(), action)) {
                continue;
            }
            if (rule.effect() == RuleEffect.DENY) {
                return PermissionDecision.denied(rule);
            }
            if (rule.localOnly() && !localRequest) {
                continue;
            }
            if (bestAllow == null || SPECIFICITY.compare(rule, bestAllow) < 0) {
                bestAllow = rule;
            }
        }
        return bestAllow != null ? PermissionDecision.allowed(bestAllow) : PermissionDecision.denied(null);
    }

    public record PermissionDecision(boolean allowed, RoleRule matchedRule) {

        static PermissionDecision allowed(RoleRule rule) {
            return new PermissionDecision(true, rule);
        }

        static PermissionDecision denied(RoleRule rule) {
            return new PermissionDecision(false, rule);
        }
    }
}
