package com.orgscope.backend.modules.access.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;

/**
 * Runs the voters in fixed precedence (permission override, scope containment, role default) and
 * returns the first decisive verdict. Denies when every voter abstains.
 */
@Component
public class AccessDecisionManager {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionManager.class);

    private final List<AccessVoter> voters;

    public AccessDecisionManager(
            PermissionOverride permissionOverride,
            ScopeResolver scopeResolver,
            RoleDefaultVoter roleDefaultVoter
    ) {
        this.voters = List.of(permissionOverride, scopeResolver, roleDefaultVoter);
    }

    public AccessVerdict decide(AccessRequest request) {
        for (AccessVoter voter : voters) {
            AccessVerdict verdict = voter.vote(request);
            if (verdict.isDecisive()) {
                if (verdict == AccessVerdict.DENY && log.isDebugEnabled()) {
                    log.debug("Access denied by {}: user={} action={} target={} endpoint={} {}",
                            voter.getClass().getSimpleName(), request.principal().userId(), request.action(),
                            request.target(), request.httpMethod(), request.resourcePath());
                }
                return verdict;
            }
        }
        return AccessVerdict.DENY;
    }

    /**
     * Decision without an endpoint, so no permission override applies.
     */
    public AccessVerdict authorize(AccessPrincipal principal, AccessAction action, OrgCoordinates target) {
        return decide(AccessRequest.of(principal, action, target));
    }

    public void check(AccessRequest request) {
        if (decide(request) != AccessVerdict.ALLOW) {
            throw new AuthorizationDeniedException(request.action() + " not permitted on the requested resource");
        }
    }
}
