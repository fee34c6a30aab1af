package com.orgscope.backend.modules.hierarchy.domain;

import java.util.Objects;

/**
 * Flat view of one hierarchy member. {@code id} is null for a node that is not persisted yet.
 */
public record HierarchyNode(
        Long id,
        Long parentId,
        Long companyId,
        Long businessGroupId,
        boolean active
) {

    public HierarchyNode {
        Objects.requireNonNull(companyId, "companyId");
        Objects.requireNonNull(businessGroupId, "businessGroupId");
    }

    public static HierarchyNode unsaved(Long companyId, Long businessGroupId) {
        return new HierarchyNode(null, null, companyId, businessGroupId, true);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean sameTenantAs(HierarchyNode other) {
        return companyId.equals(other.companyId) && businessGroupId.equals(other.businessGroupId);
    }
}
