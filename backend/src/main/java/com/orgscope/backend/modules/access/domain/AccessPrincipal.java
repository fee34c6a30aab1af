package com.orgscope.backend.modules.access.domain;

import java.util.List;
import java.util.Objects;

import com.orgscope.backend.modules.organization.domain.OrgNodeRef;

/**
 * Authenticated caller as seen by the access engine: user id, role level and the active scopes bound
 * to the user. Several scopes widen visibility to the union of their subtrees.
 */
public record AccessPrincipal(Long userId, int roleLevel, List<OrgNodeRef> scopes) {

    public AccessPrincipal {
        Objects.requireNonNull(userId, "userId");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static AccessPrincipal unscoped(Long userId, int roleLevel) {
        return new AccessPrincipal(userId, roleLevel, List.of());
    }

    public boolean hasScopes() {
        return !scopes.isEmpty();
    }
}
