package com.orgscope.backend.modules.access.config;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;

/**
 * Role table and engine switches bound from {@code orgscope.access}. Bound once at startup.
 *
 * @param scopeAdminMaxLevel        highest role level allowed to assign or revoke scopes
 * @param permissionAdminMaxLevel   highest role level allowed to manage permission overrides
 * @param basePathSegments          path segments kept for the base-path override fallback
 * @param branchScopeIncludesCorporateDepartments whether a branch scope also covers the corporate
 *                                  (branch-less) departments of the branch's company
 * @param roles                     role level to permitted actions and scope types
 */
@ConfigurationProperties(prefix = "orgscope.access")
public record AccessPolicyProperties(
        @DefaultValue("2") int scopeAdminMaxLevel,
        @DefaultValue("1") int permissionAdminMaxLevel,
        @DefaultValue("3") int basePathSegments,
        @DefaultValue("false") boolean branchScopeIncludesCorporateDepartments,
        List<RolePolicy> roles
) {

    public AccessPolicyProperties {
        roles = roles == null || roles.isEmpty() ? defaultRoles() : List.copyOf(roles);
    }

    public Optional<RolePolicy> role(int level) {
        return roles.stream().filter(role -> role.level() == level).findFirst();
    }

    public AccessPolicyProperties withBranchScopeIncludesCorporateDepartments(boolean value) {
        return new AccessPolicyProperties(scopeAdminMaxLevel, permissionAdminMaxLevel, basePathSegments, value, roles);
    }

    public static AccessPolicyProperties defaults() {
        return new AccessPolicyProperties(2, 1, 3, false, null);
    }

    public static List<RolePolicy> defaultRoles() {
        List<RolePolicy> roles = new ArrayList<>();
        roles.add(new RolePolicy(1, "ADMIN", EnumSet.allOf(AccessAction.class), true,
                EnumSet.allOf(OrgUnitType.class)));
        roles.add(new RolePolicy(2, "MANAGER",
                EnumSet.of(AccessAction.READ, AccessAction.CREATE, AccessAction.UPDATE), false,
                EnumSet.of(OrgUnitType.BUSINESS_GROUP, OrgUnitType.COMPANY, OrgUnitType.BRANCH)));
        roles.add(new RolePolicy(3, "SUPERVISOR", EnumSet.of(AccessAction.READ, AccessAction.UPDATE), false,
                EnumSet.of(OrgUnitType.DEPARTMENT)));
        roles.add(new RolePolicy(4, "COLLABORATOR", EnumSet.of(AccessAction.READ), false, Set.of()));
        roles.add(new RolePolicy(5, "GUEST", Set.of(), false, Set.of()));
        return roles;
    }

    /**
     * One row of the role table. An unrestricted role sees everything while it holds no scope; a role
     * that is neither unrestricted nor allowed any scope type only reaches resources linked to the
     * caller's own user id.
     */
    public record RolePolicy(
            int level,
            String name,
            Set<AccessAction> actions,
            boolean unrestricted,
            Set<OrgUnitType> scopeTypes
    ) {

        public RolePolicy {
            actions = actions == null || actions.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(actions));
            scopeTypes = scopeTypes == null || scopeTypes.isEmpty()
                    ? Set.of()
                    : Set.copyOf(EnumSet.copyOf(scopeTypes));
        }

        public boolean permits(AccessAction action) {
            return actions.contains(action);
        }

        public boolean allowsScopeType(OrgUnitType type) {
            return scopeTypes.contains(type);
        }

        public boolean isSelfOnly() {
            return !unrestricted && scopeTypes.isEmpty();
        }
    }
}
