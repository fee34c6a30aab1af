package com.orgscope.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.organization.domain.Branch;

public record BranchResponse(
        Long id,
        Long businessGroupId,
        Long companyId,
        String code,
        String name,
        boolean headquarters,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static BranchResponse from(Branch branch) {
        return new BranchResponse(branch.getId(), branch.getBusinessGroupId(), branch.getCompanyId(),
                branch.getCode(), branch.getName(), branch.isHeadquarters(), branch.isActive(),
                branch.getCreatedAt(), branch.getDeactivatedAt());
    }
}
