package com.orgscope.backend.modules.organization.presentation.dto;

import com.orgscope.backend.modules.organization.domain.PositionHierarchyLevel;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Null fields are left unchanged. Changing {@code hierarchyLevel} without a weight resets the weight
 * to the level's default.
 */
public record UpdatePositionRequest(
        @Size(min = 1, max = 200) String title,
        @Size(max = 50) String level,
        PositionHierarchyLevel hierarchyLevel,
        @Min(0) @Max(100) Integer hierarchyWeight,
        @Size(max = 1000) String description
) {
}
