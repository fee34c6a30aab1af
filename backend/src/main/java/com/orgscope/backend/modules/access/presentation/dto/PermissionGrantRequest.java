package com.orgscope.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PermissionGrantRequest(
        @NotBlank @Size(max = 255) String resourcePath,
        @NotBlank @Size(max = 10) String httpMethod,
        @NotNull Boolean allowed
) {
}
