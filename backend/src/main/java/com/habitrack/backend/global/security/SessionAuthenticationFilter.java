package com.habitrack.backend.global.security;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.habitrack.backend.modules.auth.application.SessionManager;
import com.habitrack.backend.modules.auth.domain.HouseholdUser;
import com.habitrack.backend.modules.auth.domain.UserSession;
import com.habitrack.backend.modules.auth.infrastructure.persistence.HouseholdUserRepository;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session cookie into a {@link SessionPrincipal}. Requests without a live session
 * continue anonymously and are rejected later by the authorization rules where needed.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private final SessionCookieSupport sessionCookieSupport;
    private final SessionManager sessionManager;
    private final HouseholdUserRepository householdUserRepository;

    public SessionAuthenticationFilter(
            SessionCookieSupport sessionCookieSupport,
            SessionManager sessionManager,
            HouseholdUserRepository householdUserRepository
    ) {
        this.sessionCookieSupport = sessionCookieSupport;
        this.sessionManager = sessionManager;
        this.householdUserRepository = householdUserRepository;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> sid = sessionCookieSupport.readSid(request);
        if (sid.isPresent()) {
            sessionManager.get(sid.get())
                    .flatMap(session -> toPrincipal(session, response))
                    .ifPresent(principal -> authenticate(request, principal));
        }

        filterChain.doFilter(request, response);
    }

    private Optional<SessionPrincipal> toPrincipal(UserSession session, HttpServletResponse response) {
        Optional<HouseholdUser> user = householdUserRepository.findById(session.getUserId());
        if (user.isEmpty() || !user.get().isActive()) {
            log.debug("Ignoring session of missing or inactive user {}", session.getUserId());
            return Optional.empty();
        }
        OffsetDateTime previousExpiry = session.getExpiresAt();
        UserSession current = sessionManager.touch(session).orElse(session);
        if (!current.getExpiresAt().equals(previousExpiry)) {
            sessionCookieSupport.write(response, current);
        }
        // role comes from the user row so demotions apply to live sessions
        return Optional.of(new SessionPrincipal(
                current.getUserId(),
                user.get().getDisplayName(),
                user.get().getRole(),
                current.getSid(),
                current.isKiosk(),
                current.getImpersonatedBy(),
                current.getExpiresAt()
        ));
    }

    private void authenticate(HttpServletRequest request, SessionPrincipal principal) {
        List<SimpleGrantedAuthority> authorities =
                List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }
}
