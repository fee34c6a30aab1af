package com.orgscope.backend.modules.access.presentation.dto;

/**
 * {@code grantPath} is the resource path a permission grant has to name to cover this endpoint;
 * null when no grant path can reach it.
 */
public record EndpointResponse(
        String path,
        String method,
        String handler,
        String grantPath
) {
}
