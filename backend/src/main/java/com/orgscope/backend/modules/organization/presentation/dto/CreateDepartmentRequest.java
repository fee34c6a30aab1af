package com.orgscope.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Without a branch the department is corporate-level. When a parent is given the branch defaults
 * to the parent's.
 */
public record CreateDepartmentRequest(
        @NotNull Long companyId,
        Long branchId,
        Long parentId,
        @NotBlank @Size(max = 50) String code,
        @NotBlank @Size(max = 200) String name,
        @Size(max = 1000) String description
) {
}
