package com.habitrack.backend.modules.permission.infrastructure;

import java.util.List;

import com.habitrack.backend.modules.permission.domain.PermissionRule;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRuleRepository extends JpaRepository<PermissionRule, Long> {

    List<PermissionRule> findAllByOrderByIdAsc();
}
