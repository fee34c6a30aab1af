package com.orgscope.backend.modules.access.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.orgscope.backend.modules.access.domain.UserScope;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;

public interface UserScopeRepository extends JpaRepository<UserScope, Long> {

    List<UserScope> findByUserIdAndActiveTrueOrderByIdAsc(Long userId);

    Optional<UserScope> findByIdAndUserId(Long id, Long userId);

    boolean existsByUserIdAndScopeTypeAndScopeIdAndActiveTrue(Long userId, OrgUnitType scopeType, Long scopeId);
}
