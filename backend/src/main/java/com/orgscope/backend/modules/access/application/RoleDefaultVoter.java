package com.orgscope.backend.modules.access.application;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties.RolePolicy;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;

/**
 * Last voter: decides from the role alone. Unrestricted roles get their action set everywhere,
 * self-only roles only on resources linked to their own user id, every other case is denied.
 */
@Component
public class RoleDefaultVoter implements AccessVoter {

    private final AccessPolicyProperties properties;

    public RoleDefaultVoter(AccessPolicyProperties properties) {
        this.properties = properties;
    }

    @Override
    public AccessVerdict vote(AccessRequest request) {
        AccessPrincipal principal = request.principal();
        Optional<RolePolicy> found = properties.role(principal.roleLevel());
        if (found.isEmpty() || !found.get().permits(request.action())) {
            return AccessVerdict.DENY;
        }
        RolePolicy role = found.get();
        if (role.unrestricted()) {
            return AccessVerdict.ALLOW;
        }
        if (role.isSelfOnly() && principal.userId().equals(request.target().ownerUserId())) {
            return AccessVerdict.ALLOW;
        }
        return AccessVerdict.DENY;
    }
}
