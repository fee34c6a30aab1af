package com.orgscope.backend.modules.organization.domain;

import java.util.Objects;

/**
 * Identifies one node of the organizational tree by level and id.
 */
public record OrgNodeRef(OrgUnitType type, long id) {

    public OrgNodeRef {
        Objects.requireNonNull(type, "type");
    }

    public static OrgNodeRef businessGroup(long id) {
        return new OrgNodeRef(OrgUnitType.BUSINESS_GROUP, id);
    }

    public static OrgNodeRef company(long id) {
        return new OrgNodeRef(OrgUnitType.COMPANY, id);
    }

    public static OrgNodeRef branch(long id) {
        return new OrgNodeRef(OrgUnitType.BRANCH, id);
    }

    public static OrgNodeRef department(long id) {
        return new OrgNodeRef(OrgUnitType.DEPARTMENT, id);
    }

    @Override
    public String toString() {
        return type.tag() + ":" + id;
    }
}
