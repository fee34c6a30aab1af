package com.orgscope.backend.modules.access.presentation.dto;

import com.orgscope.backend.modules.organization.domain.OrgUnitType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AssignScopeRequest(
        @NotNull OrgUnitType scopeType,
        @NotNull @Positive Long scopeId
) {
}
