package com.orgscope.backend.modules.organization.domain;

/**
 * Organizational position of a resource. Any coordinate may be null when the resource sits above
 * that level (a company has no branch, a corporate department has no branch). {@code ownerUserId}
 * is the user account directly tied to the resource, used for self-access.
 */
public record OrgCoordinates(
        Long businessGroupId,
        Long companyId,
        Long branchId,
        Long departmentId,
        Long ownerUserId
) {

    public static OrgCoordinates ofBusinessGroup(Long businessGroupId) {
        return new OrgCoordinates(businessGroupId, null, null, null, null);
    }

    public static OrgCoordinates ofCompany(Long businessGroupId, Long companyId) {
        return new OrgCoordinates(businessGroupId, companyId, null, null, null);
    }

    public static OrgCoordinates ofBranch(Long businessGroupId, Long companyId, Long branchId) {
        return new OrgCoordinates(businessGroupId, companyId, branchId, null, null);
    }

    public static OrgCoordinates ofDepartment(Long businessGroupId, Long companyId, Long branchId, Long departmentId) {
        return new OrgCoordinates(businessGroupId, companyId, branchId, departmentId, null);
    }

    public OrgCoordinates withOwner(Long userId) {
        return new OrgCoordinates(businessGroupId, companyId, branchId, departmentId, userId);
    }

    public Long valueOf(OrgUnitType type) {
        return switch (type) {
            case BUSINESS_GROUP -> businessGroupId;
            case COMPANY -> companyId;
            case BRANCH -> branchId;
            case DEPARTMENT -> departmentId;
        };
    }

    /**
     * Innermost populated level, or null when no coordinate is set.
     */
    public OrgNodeRef deepestNode() {
        if (departmentId != null) {
            return OrgNodeRef.department(departmentId);
        }
        if (branchId != null) {
            return OrgNodeRef.branch(branchId);
        }
        if (companyId != null) {
            return OrgNodeRef.company(companyId);
        }
        if (businessGroupId != null) {
            return OrgNodeRef.businessGroup(businessGroupId);
        }
        return null;
    }
}
