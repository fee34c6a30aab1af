package com.orgscope.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Null fields are left unchanged.
 */
public record UpdateBranchRequest(
        @Size(min = 1, max = 200) String name,
        Boolean headquarters
) {
}
