package com.orgscope.backend.modules.access.application;

import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.orgscope.backend.global.security.AuthenticatedUser;
import com.orgscope.backend.global.security.SecurityUtils;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.UserScope;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserScopeRepository;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;

@Component
public class PrincipalResolver {

    private final UserScopeRepository userScopeRepository;

    public PrincipalResolver(UserScopeRepository userScopeRepository) {
        this.userScopeRepository = userScopeRepository;
    }

    @Transactional(readOnly = true)
    public AccessPrincipal current() {
        return resolve(SecurityUtils.getCurrentUser());
    }

    @Transactional(readOnly = true)
    public AccessPrincipal resolve(AuthenticatedUser user) {
        List<OrgNodeRef> scopes = userScopeRepository.findByUserIdAndActiveTrueOrderByIdAsc(user.userId())
                .stream()
                .map(UserScope::toNodeRef)
                .toList();
        return new AccessPrincipal(user.userId(), user.roleLevel(), scopes);
    }
}
