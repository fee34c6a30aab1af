package com.orgscope.backend.modules.access.application;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties.RolePolicy;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;

/**
 * Scope containment: a scoped principal may act on a target when one of its scopes lies on the
 * target's path to the business group and the role allows the action. Abstains for principals
 * without an effective scope so the role default can decide.
 */
@Component
public class ScopeResolver implements AccessVoter {

    private final AccessPolicyProperties properties;
    private final OrgPathResolver orgPathResolver;

    public ScopeResolver(AccessPolicyProperties properties, OrgPathResolver orgPathResolver) {
        this.properties = properties;
        this.orgPathResolver = orgPathResolver;
    }

    @Override
    public AccessVerdict vote(AccessRequest request) {
        AccessPrincipal principal = request.principal();
        Optional<RolePolicy> role = properties.role(principal.roleLevel());
        List<OrgNodeRef> scopes = effectiveScopes(principal, role);
        if (scopes.isEmpty()) {
            return AccessVerdict.ABSTAIN;
        }
        if (!role.get().permits(request.action())) {
            return AccessVerdict.DENY;
        }
        OrgCoordinates target = request.target();
        Set<OrgNodeRef> path = orgPathResolver.pathOf(target);
        for (OrgNodeRef scope : scopes) {
            if (path.contains(scope) || coversCorporateDepartment(scope, target)) {
                return AccessVerdict.ALLOW;
            }
        }
        return AccessVerdict.DENY;
    }

    /**
     * Scopes whose type the principal's role accepts. Others, left over from an earlier role, are
     * ignored.
     */
    public List<OrgNodeRef> effectiveScopes(AccessPrincipal principal) {
        return effectiveScopes(principal, properties.role(principal.roleLevel()));
    }

    private static List<OrgNodeRef> effectiveScopes(AccessPrincipal principal, Optional<RolePolicy> role) {
        if (role.isEmpty() || !principal.hasScopes()) {
            return List.of();
        }
        return principal.scopes().stream()
                .filter(scope -> role.get().allowsScopeType(scope.type()))
                .toList();
    }

    private boolean coversCorporateDepartment(OrgNodeRef scope, OrgCoordinates target) {
        if (!properties.branchScopeIncludesCorporateDepartments()
                || scope.type() != OrgUnitType.BRANCH
                || target.departmentId() == null
                || target.branchId() != null
                || target.companyId() == null) {
            return false;
        }
        return orgPathResolver.companyOfBranch(scope.id())
                .map(target.companyId()::equals)
                .orElse(false);
    }
}
