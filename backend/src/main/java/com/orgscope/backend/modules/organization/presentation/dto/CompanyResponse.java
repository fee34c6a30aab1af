package com.orgscope.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.organization.domain.Company;

public record CompanyResponse(
        Long id,
        Long businessGroupId,
        String code,
        String name,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static CompanyResponse from(Company company) {
        return new CompanyResponse(company.getId(), company.getBusinessGroupId(), company.getCode(),
                company.getName(), company.isActive(), company.getCreatedAt(), company.getDeactivatedAt());
    }
}
