package com.orgscope.backend.modules.access.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.access.domain.UserScope;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;

public record UserScopeResponse(
        Long id,
        Long userId,
        OrgUnitType scopeType,
        Long scopeId,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime revokedAt
) {

    public static UserScopeResponse from(UserScope scope) {
        return new UserScopeResponse(
                scope.getId(),
                scope.getUserId(),
                scope.getScopeType(),
                scope.getScopeId(),
                scope.isActive(),
                scope.getCreatedAt(),
                scope.getRevokedAt());
    }
}
