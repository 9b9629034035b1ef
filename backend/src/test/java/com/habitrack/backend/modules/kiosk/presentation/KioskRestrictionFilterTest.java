package com.habitrack.backend.modules.kiosk.presentation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.habitrack.backend.global.error.ProblemResponseWriter;
import com.habitrack.backend.global.security.SessionPrincipal;
import com.habitrack.backend.modules.auth.domain.HouseholdRole;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class KioskRestrictionFilterTest {

    private final KioskRestrictionFilter filter = new KioskRestrictionFilter(new ProblemResponseWriter(new ObjectMapper()));

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void kioskAdminCannotReachAdminEndpoints() throws Exception {
        authenticate(HouseholdRole.ADMIN, true);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("POST", "/admin/impersonate/5"), response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("KIOSK_RESTRICTED");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void kioskCannotChangeCredentials() throws Exception {
        authenticate(HouseholdRole.MEMBER, true);
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("POST", "/auth/creds/change"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void kioskMayStillReadSession() throws Exception {
        authenticate(HouseholdRole.KID, true);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/auth/session"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void regularAdminSessionIsUnaffected() throws Exception {
        authenticate(HouseholdRole.ADMIN, false);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("PUT", "/admin/users/3/pin"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void restrictedPatternsCoverNestedAdminPaths() {
        assertThat(filter.isRestricted("/admin/users/1/password")).isTrue();
        assertThat(filter.isRestricted("/admin")).isTrue();
        assertThat(filter.isRestricted("/auth/creds/login")).isFalse();
    }

    private static void authenticate(HouseholdRole role, boolean kiosk) {
        SessionPrincipal principal = new SessionPrincipal(1L, "User 1", role, "sid", kiosk, null,
                OffsetDateTime.parse("2030-01-01T00:00:00Z"));
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(principal, null,
                List.of(new SimpleGrantedAuthority("ROLE_" + role.name()))));
    }
}
