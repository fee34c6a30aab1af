package com.orgscope.backend.modules.access.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Full replacement of a user's overrides. An empty list clears them all.
 */
public record ReplacePermissionsRequest(
        @NotNull List<@Valid PermissionGrantRequest> grants
) {
}
