package com.habitrack.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.habitrack.backend.modules.permission.application.PermissionEvaluator.PermissionDecision;
import com.habitrack.backend.modules.permission.domain.RoleRule;

import org.junit.jupiter.api.Test;

class PermissionEvaluatorTest {

    @Test
    void globMatching() {
        assertThat(allows("*", "anything.at.all")).isTrue();
        assertThat(allows("chores.*", "chores.complete")).isTrue();
        assertThat(allows("chores.*", "chores.")).isTrue();
        assertThat(allows("chores.*", "chore.complete")).isFalse();
        assertThat(allows("*.read", "dashboard.read")).isTrue();
        assertThat(allows("*.read", "dashboard.write")).isFalse();
        assertThat(allows("a*b*c", "axxbyyc")).isTrue();
        assertThat(allows("a*b*c", "axxbyy")).isFalse();
        assertThat(allows("exact", "exact")).isTrue();
        assertThat(allows("exact", "exactly")).isFalse();
    }

    @Test
    void denyBeatsAnyAllow() {
        List<RoleRule> rules = List.of(RoleRule.allow("*"), RoleRule.allow("finance.export"), RoleRule.deny("finance.*"));

        PermissionDecision decision = PermissionEvaluator.evaluate("finance.export", rules, true);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.matchedRule()).isEqualTo(RoleRule.deny("finance.*"));
    }

    @Test
    void mostSpecificAllowIsReported() {
        List<RoleRule> rules = List.of(RoleRule.allow("*"), RoleRule.allow("chores.*"), RoleRule.allow("chores.complete"));

        PermissionDecision decision = PermissionEvaluator.evaluate("chores.complete", rules, false);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.matchedRule().actionPattern()).isEqualTo("chores.complete");
    }

    @Test
    void localOnlyAllowNeedsLocalRequest() {
        List<RoleRule> rules = List.of(RoleRule.allowLocal("dashboard.read"));

        assertThat(PermissionEvaluator.evaluate("dashboard.read", rules, true).allowed()).isTrue();
        assertThat(PermissionEvaluator.evaluate("dashboard.read", rules, false).allowed()).isFalse();
    }

    @Test
    void noMatchOrNoRulesIsDeny() {
        assertThat(PermissionEvaluator.evaluate("chores.read", List.of(RoleRule.allow("meals.*")), true).allowed())
                .isFalse();
        assertThat(PermissionEvaluator.evaluate("chores.read", List.of(), true).allowed()).isFalse();
        assertThat(PermissionEvaluator.evaluate("", List.of(RoleRule.allow("*")), true).allowed()).isFalse();
    }

    @Test
    void patternsWithoutWildcardMatchExactly() {
        assertThat(allows("chores.complete", "chores.complete")).isTrue();
        assertThat(allows("chores.complete", "chores.completeAll")).isFalse();
        assertThat(allows("chores.complete", "Chores.complete")).isFalse();
    }

    private static boolean allows(String pattern, String action) {
        return PermissionEvaluator.evaluate(action, List.of(RoleRule.allow(pattern)), true).allowed();
    }
}
