package com.orgscope.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.organization.domain.Position;
import com.orgscope.backend.modules.organization.domain.PositionHierarchyLevel;

public record PositionResponse(
        Long id,
        Long businessGroupId,
        Long companyId,
        String title,
        String level,
        PositionHierarchyLevel hierarchyLevel,
        int hierarchyWeight,
        String description,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static PositionResponse from(Position position) {
        return new PositionResponse(position.getId(), position.getBusinessGroupId(), position.getCompanyId(),
                position.getTitle(), position.getLevel(), position.getHierarchyLevel(), position.getHierarchyWeight(),
                position.getDescription(), position.isActive(), position.getCreatedAt(), position.getDeactivatedAt());
    }
}
