package com.orgscope.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateBranchRequest(
        @NotNull Long companyId,
        @NotBlank @Size(max = 50) String code,
        @NotBlank @Size(max = 200) String name,
        boolean headquarters
) {
}
