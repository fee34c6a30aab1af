package com.orgscope.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Null fields are left unchanged. {@code parentId} moves the department; {@code detachFromParent}
 * makes it a root.
 */
public record UpdateDepartmentRequest(
        @Size(min = 1, max = 200) String name,
        @Size(max = 1000) String description,
        Long parentId,
        Boolean detachFromParent
) {

    public boolean detach() {
        return Boolean.TRUE.equals(detachFromParent);
    }
}
