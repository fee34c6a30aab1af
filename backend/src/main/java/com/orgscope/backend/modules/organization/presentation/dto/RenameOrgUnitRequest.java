package com.orgscope.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameOrgUnitRequest(
        @NotBlank @Size(max = 200) String name
) {
}
