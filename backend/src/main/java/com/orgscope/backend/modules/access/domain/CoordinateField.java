package com.orgscope.backend.modules.access.domain;

import java.util.function.Function;

import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;

public enum CoordinateField {
    BUSINESS_GROUP(OrgCoordinates::businessGroupId),
    COMPANY(OrgCoordinates::companyId),
    BRANCH(OrgCoordinates::branchId),
    DEPARTMENT(OrgCoordinates::departmentId),
    OWNER_USER_ID(OrgCoordinates::ownerUserId);

    private final Function<OrgCoordinates, Long> extractor;

    CoordinateField(Function<OrgCoordinates, Long> extractor) {
        this.extractor = extractor;
    }

    public Long valueIn(OrgCoordinates coordinates) {
        return extractor.apply(coordinates);
    }

    public static CoordinateField of(OrgUnitType type) {
        return switch (type) {
            case BUSINESS_GROUP -> BUSINESS_GROUP;
            case COMPANY -> COMPANY;
            case BRANCH -> BRANCH;
            case DEPARTMENT -> DEPARTMENT;
        };
    }
}
