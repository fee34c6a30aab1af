package com.orgscope.backend.modules.access.presentation.dto;

import java.util.Map;

/**
 * Active overrides of one user as {@code path -> method -> allowed}.
 */
public record PermissionMatrixResponse(
        Long userId,
        Map<String, Map<String, Boolean>> permissions
) {
}
