package com.habitrack.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;

import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.modules.auth.domain.HouseholdRole;
import com.habitrack.backend.modules.permission.infrastructure.PermissionRuleRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PermissionServiceTest {

    @Mock
    private PermissionRuleRepository permissionRuleRepository;

    @Test
    void kioskDashboardOnlyFromHouseholdNetwork() {
        PermissionService service = new PermissionService(new PermissionCache(permissionRuleRepository));
        SessionPrincipal kiosk = principal(HouseholdRole.KIOSK);

        assertThat(service.check(kiosk, "dashboard.read", true).allowed()).isTrue();
        assertThat(service.check(kiosk, "dashboard.read", false).allowed()).isFalse();
        assertThat(service.check(kiosk, "chores.write", true).allowed()).isFalse();
    }

    @Test
    void adminWildcardAllowsEverything() {
        PermissionService service = new PermissionService(new PermissionCache(permissionRuleRepository));

        assertThat(service.check(principal(HouseholdRole.ADMIN), "budgets.delete", false).matchedRule().actionPattern())
                .isEqualTo("*");
        assertThat(service.rulesFor(principal(HouseholdRole.MEMBER))).isEmpty();
    }

    private static SessionPrincipal principal(HouseholdRole role) {
        return new SessionPrincipal(3L, "User 3", role, "sid", role == HouseholdRole.KIOSK, null,
                OffsetDateTime.parse("2030-01-01T00:00:00Z"));
    }
}
