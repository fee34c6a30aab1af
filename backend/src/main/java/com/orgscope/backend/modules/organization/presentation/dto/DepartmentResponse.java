package com.orgscope.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.organization.domain.Department;

public record DepartmentResponse(
        Long id,
        Long businessGroupId,
        Long companyId,
        Long branchId,
        Long parentId,
        String code,
        String name,
        String description,
        boolean corporate,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static DepartmentResponse from(Department department) {
        return new DepartmentResponse(
                department.getId(),
                department.getBusinessGroupId(),
                department.getCompanyId(),
                department.getBranchId(),
                department.getParentId(),
                department.getCode(),
                department.getName(),
                department.getDescription(),
                department.isCorporate(),
                department.isActive(),
                department.getCreatedAt(),
                department.getDeactivatedAt());
    }
}
