package com.orgscope.backend.modules.access.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties.RolePolicy;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPredicate;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.CoordinateCondition;
import com.orgscope.backend.modules.access.domain.CoordinateField;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;

/**
 * Builds the row filter for list reads. A row passes the filter exactly when
 * {@link ScopeResolver} or {@link RoleDefaultVoter} would allow READ on it.
 */
@Component
public class AccessFilter {

    private final AccessPolicyProperties properties;
    private final ScopeResolver scopeResolver;
    private final OrgPathResolver orgPathResolver;

    public AccessFilter(AccessPolicyProperties properties, ScopeResolver scopeResolver,
            OrgPathResolver orgPathResolver) {
        this.properties = properties;
        this.scopeResolver = scopeResolver;
        this.orgPathResolver = orgPathResolver;
    }

    public AccessPredicate buildFilter(AccessPrincipal principal) {
        Optional<RolePolicy> role = properties.role(principal.roleLevel());
        if (role.isEmpty() || !role.get().permits(AccessAction.READ)) {
            return AccessPredicate.none();
        }
        List<OrgNodeRef> scopes = scopeResolver.effectiveScopes(principal);
        if (!scopes.isEmpty()) {
            return scopeFilter(scopes);
        }
        if (role.get().unrestricted()) {
            return AccessPredicate.unrestricted();
        }
        if (role.get().isSelfOnly()) {
            return selfFilter(principal);
        }
        return AccessPredicate.none();
    }

    /**
     * Row filter for a list the caller holds an explicit allow override on. The role's action set is
     * not consulted: rows are bounded by the caller's scopes, by nothing for an unrestricted role
     * without scopes, and by self-access otherwise.
     */
    public AccessPredicate buildGrantedFilter(AccessPrincipal principal) {
        List<OrgNodeRef> scopes = scopeResolver.effectiveScopes(principal);
        if (!scopes.isEmpty()) {
            return scopeFilter(scopes);
        }
        boolean unrestricted = properties.role(principal.roleLevel())
                .map(RolePolicy::unrestricted)
                .orElse(false);
        return unrestricted ? AccessPredicate.unrestricted() : selfFilter(principal);
    }

    private AccessPredicate scopeFilter(List<OrgNodeRef> scopes) {
        List<List<CoordinateCondition>> clauses = new ArrayList<>();
        for (OrgNodeRef scope : scopes) {
            clauses.addAll(clausesFor(scope));
        }
        return AccessPredicate.anyOf(clauses);
    }

    private static AccessPredicate selfFilter(AccessPrincipal principal) {
        return AccessPredicate.allOf(CoordinateCondition.in(CoordinateField.OWNER_USER_ID, principal.userId()));
    }

    private List<List<CoordinateCondition>> clausesFor(OrgNodeRef scope) {
        List<List<CoordinateCondition>> clauses = new ArrayList<>();
        switch (scope.type()) {
            case DEPARTMENT -> clauses.add(List.of(CoordinateCondition.in(CoordinateField.DEPARTMENT,
                    orgPathResolver.departmentSubtree(scope.id()))));
            case BRANCH -> {
                clauses.add(List.of(CoordinateCondition.in(CoordinateField.BRANCH, scope.id())));
                if (properties.branchScopeIncludesCorporateDepartments()) {
                    orgPathResolver.companyOfBranch(scope.id()).ifPresent(companyId -> clauses.add(List.of(
                            CoordinateCondition.in(CoordinateField.COMPANY, companyId),
                            CoordinateCondition.isNull(CoordinateField.BRANCH),
                            CoordinateCondition.notNull(CoordinateField.DEPARTMENT))));
                }
            }
            default -> clauses.add(List.of(CoordinateCondition.in(CoordinateField.of(scope.type()), scope.id())));
        }
        return clauses;
    }
}
