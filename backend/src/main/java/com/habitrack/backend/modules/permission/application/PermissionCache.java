package com.habitrack.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.habitrack.backend.modules.auth.domain.HouseholdRole;
import com.habitrack.backend.modules.permission.domain.PermissionRule;
import com.habitrack.backend.modules.permission.domain.RoleRule;
import com.habitrack.backend.modules.permission.infrastructure.PermissionRuleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Process-wide role to rule-list mapping.
 * <p>
 * Readers always see a complete immutable snapshot. {@link #refresh()} replaces rules role by role;
 * a role without any stored rows keeps what it had before, starting from the built-in defaults.
 */
@Component
public class PermissionCache {

    private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

    static final Map<HouseholdRole, List<RoleRule>> DEFAULTS = Collections.unmodifiableMap(new EnumMap<>(Map.of(
            HouseholdRole.ADMIN, List.of(RoleRule.allow("*")),
            HouseholdRole.MEMBER, List.of(),
            HouseholdRole.KID, List.of(),
            HouseholdRole.KIOSK, List.of(RoleRule.allowLocal("dashboard.read"))
    )));

    private final PermissionRuleRepository permissionRuleRepository;
    private final AtomicReference<Map<HouseholdRole, List<RoleRule>>> snapshot = new AtomicReference<>(DEFAULTS);

    public PermissionCache(PermissionRuleRepository permissionRuleRepository) {
        this.permissionRuleRepository = permissionRuleRepository;
    }

    /**
     * Reloads every rule from storage. Persistence errors propagate and leave the current snapshot in place.
     *
     * @return number of rows read
     */
    @Transactional(readOnly = true)
    public synchronized int refresh() {
        List<PermissionRule> rows = permissionRuleRepository.findAllByOrderByIdAsc();

        Map<HouseholdRole, List<RoleRule>> loaded = new EnumMap<>(HouseholdRole.class);
        for (PermissionRule row : rows) {
            if (row.getRole() == null) {
                continue;
            }
            loaded.computeIfAbsent(row.getRole(), role -> new ArrayList<>()).add(row.toRule());
        }

        Map<HouseholdRole, List<RoleRule>> previous = snapshot.get();
        Map<HouseholdRole, List<RoleRule>> next = new EnumMap<>(HouseholdRole.class);
        for (HouseholdRole role : HouseholdRole.values()) {
            List<RoleRule> fresh = loaded.get(role);
            if (fresh == null || fresh.isEmpty()) {
                next.put(role, previous.getOrDefault(role, List.of()));
            } else {
                next.put(role, List.copyOf(fresh));
            }
        }
        snapshot.set(Collections.unmodifiableMap(next));
        log.debug("Permission rules refreshed from {} row(s)", rows.size());
        return rows.size();
    }

    public List<RoleRule> getRules(HouseholdRole role) {
        if (role == null) {
            return List.of();
        }
        return snapshot.get().getOrDefault(role, List.of());
    }

    public List<RoleRule> getRules(String roleCode) {
        return HouseholdRole.fromCode(roleCode).map(this::getRules).orElse(List.of());
    }
}
