package com.orgscope.backend.modules.access.domain;

import java.util.Objects;

import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

/**
 * One point decision. {@code resourcePath} and {@code httpMethod} are null when the check does not
 * run on behalf of an HTTP endpoint, in which case no permission override applies.
 */
public record AccessRequest(
        AccessPrincipal principal,
        AccessAction action,
        OrgCoordinates target,
        String resourcePath,
        String httpMethod
) {

    public AccessRequest {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(target, "target");
    }

    public static AccessRequest of(AccessPrincipal principal, AccessAction action, OrgCoordinates target) {
        return new AccessRequest(principal, action, target, null, null);
    }

    public boolean hasEndpoint() {
        return resourcePath != null && httpMethod != null;
    }
}
