package com.orgscope.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.organization.domain.BusinessGroup;

public record BusinessGroupResponse(
        Long id,
        String code,
        String name,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static BusinessGroupResponse from(BusinessGroup group) {
        return new BusinessGroupResponse(group.getId(), group.getCode(), group.getName(), group.isActive(),
                group.getCreatedAt(), group.getDeactivatedAt());
    }
}
