package com.orgscope.backend.modules.access.application;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.global.security.SecurityUtils.Endpoint;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPredicate;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

/**
 * Entry point used by application services: point checks for the current caller on the endpoint
 * being served, and the row filter for list reads.
 */
@Component
public class AccessGuard {

    private final PrincipalResolver principalResolver;
    private final AccessDecisionManager accessDecisionManager;
    private final AccessFilter accessFilter;
    private final PermissionOverride permissionOverride;
    private final AccessPolicyProperties properties;

    public AccessGuard(
            PrincipalResolver principalResolver,
            AccessDecisionManager accessDecisionManager,
            AccessFilter accessFilter,
            PermissionOverride permissionOverride,
            AccessPolicyProperties properties
    ) {
        this.principalResolver = principalResolver;
        this.accessDecisionManager = accessDecisionManager;
        this.accessFilter = accessFilter;
        this.permissionOverride = permissionOverride;
        this.properties = properties;
    }

    public AccessPrincipal currentPrincipal() {
        return principalResolver.current();
    }

    public void require(AccessAction action, OrgCoordinates target) {
        AccessPrincipal principal = principalResolver.current();
        Optional<Endpoint> endpoint = SecurityUtils.currentEndpoint();
        accessDecisionManager.check(new AccessRequest(
                principal,
                action,
                target,
                endpoint.map(Endpoint::path).orElse(null),
                endpoint.map(Endpoint::method).orElse(null)));
    }

    /**
     * Row filter for a list read by the current caller. An explicit deny on the endpoint, or a role
     * without READ and no explicit allow, is a 403 rather than an empty list. An explicit allow
     * yields {@link AccessFilter#buildGrantedFilter(AccessPrincipal)}.
     */
    public AccessPredicate listFilter() {
        AccessPrincipal principal = principalResolver.current();
        Optional<Boolean> override = SecurityUtils.currentEndpoint()
                .flatMap(endpoint -> permissionOverride.lookup(principal.userId(), endpoint.path(), endpoint.method()));
        if (override.isPresent()) {
            if (!override.get()) {
                throw new AuthorizationDeniedException("Listing is denied for this endpoint");
            }
            return accessFilter.buildGrantedFilter(principal);
        }
        boolean canRead = properties.role(principal.roleLevel())
                .map(role -> role.permits(AccessAction.READ))
                .orElse(false);
        if (!canRead) {
            throw new AuthorizationDeniedException("Role level " + principal.roleLevel() + " cannot read");
        }
        return accessFilter.buildFilter(principal);
    }

    /**
     * Requires the current caller's role level to be at most {@code maxLevel}.
     */
    public AccessPrincipal requireRoleLevelAtMost(int maxLevel) {
        AccessPrincipal principal = principalResolver.current();
        if (principal.roleLevel() > maxLevel) {
            throw new AuthorizationDeniedException("Requires role level " + maxLevel + " or lower");
        }
        return principal;
    }
}
