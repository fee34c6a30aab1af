package com.orgscope.backend.modules.organization.presentation.dto;

import com.orgscope.backend.modules.organization.domain.PositionHierarchyLevel;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Without {@code hierarchyWeight} the default weight of {@code hierarchyLevel} is used.
 */
public record CreatePositionRequest(
        @NotNull Long companyId,
        @NotBlank @Size(max = 200) String title,
        @Size(max = 50) String level,
        @NotNull PositionHierarchyLevel hierarchyLevel,
        @Min(0) @Max(100) Integer hierarchyWeight,
        @Size(max = 1000) String description
) {
}
