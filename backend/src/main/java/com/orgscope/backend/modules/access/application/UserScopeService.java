package com.orgscope.backend.modules.access.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.orgscope.backend.global.error.ConstraintViolations;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.error.UniquenessConflictException;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.access.domain.UserAccount;
import com.orgscope.backend.modules.access.domain.UserScope;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserAccountRepository;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserScopeRepository;
import com.orgscope.backend.modules.access.presentation.dto.AssignScopeRequest;
import com.orgscope.backend.modules.access.presentation.dto.UserScopeResponse;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;

@Service
@Transactional
public class UserScopeService {

    private static final Logger log = LoggerFactory.getLogger(UserScopeService.class);

    static final String ACTIVE_SCOPE_CONSTRAINT = "uq_user_scope_active";

    private final UserScopeRepository userScopeRepository;
    private final UserAccountRepository userAccountRepository;
    private final OrgPathResolver orgPathResolver;
    private final AccessGuard accessGuard;
    private final AccessPolicyProperties properties;
    private final Clock clock;

    public UserScopeService(
            UserScopeRepository userScopeRepository,
            UserAccountRepository userAccountRepository,
            OrgPathResolver orgPathResolver,
            AccessGuard accessGuard,
            AccessPolicyProperties properties,
            Clock clock
    ) {
        this.userScopeRepository = userScopeRepository;
        this.userAccountRepository = userAccountRepository;
        this.orgPathResolver = orgPathResolver;
        this.accessGuard = accessGuard;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<UserScopeResponse> listScopes(Long userId) {
        AccessPrincipal actor = accessGuard.currentPrincipal();
        if (!actor.userId().equals(userId) && actor.roleLevel() > properties.scopeAdminMaxLevel()) {
            throw new AuthorizationDeniedException("Scopes of other users are not visible");
        }
        loadUser(userId);
        return userScopeRepository.findByUserIdAndActiveTrueOrderByIdAsc(userId).stream()
                .map(UserScopeResponse::from)
                .toList();
    }

    /**
     * Binds a scope to a user. The acting user needs scope-admin rank and must itself be allowed to
     * create inside the scope node; the target user's role must accept the scope type.
     */
    public UserScopeResponse assignScope(Long userId, AssignScopeRequest request) {
        AccessPrincipal actor = accessGuard.requireRoleLevelAtMost(properties.scopeAdminMaxLevel());
        UserAccount user = userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found"));
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "user.inactive");
        }
        boolean typeAllowed = properties.role(user.getRoleLevel())
                .map(role -> role.allowsScopeType(request.scopeType()))
                .orElse(false);
        if (!typeAllowed) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "scope.type_not_permitted",
                    "Role level " + user.getRoleLevel() + " cannot hold a " + request.scopeType().tag() + " scope");
        }
        OrgNodeRef node = new OrgNodeRef(request.scopeType(), request.scopeId());
        OrgCoordinates coordinates = orgPathResolver.coordinatesOf(node);
        accessGuard.require(AccessAction.CREATE, coordinates);

        if (userScopeRepository.existsByUserIdAndScopeTypeAndScopeIdAndActiveTrue(userId, node.type(), node.id())) {
            throw duplicate(userId, node);
        }
        UserScope saved;
        try {
            saved = userScopeRepository.saveAndFlush(new UserScope(userId, node));
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, ACTIVE_SCOPE_CONSTRAINT)) {
                throw duplicate(userId, node);
            }
            throw ex;
        }
        log.info("Scope {} assigned to user {} by user {}", node, userId, actor.userId());
        return UserScopeResponse.from(saved);
    }

    public UserScopeResponse revokeScope(Long userId, Long scopeId) {
        AccessPrincipal actor = accessGuard.requireRoleLevelAtMost(properties.scopeAdminMaxLevel());
        UserScope scope = userScopeRepository.findByIdAndUserId(scopeId, userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "scope.not_found"));
        if (!scope.isActive()) {
            return UserScopeResponse.from(scope);
        }
        accessGuard.require(AccessAction.UPDATE, orgPathResolver.coordinatesOf(scope.toNodeRef()));
        scope.revoke(OffsetDateTime.now(clock));
        log.info("Scope {} revoked from user {} by user {}", scope.toNodeRef(), userId, actor.userId());
        return UserScopeResponse.from(scope);
    }

    private UserAccount loadUser(Long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found"));
    }

    private static UniquenessConflictException duplicate(Long userId, OrgNodeRef node) {
        return new UniquenessConflictException("scope.duplicate_assignment",
                "User " + userId + " already holds scope " + node);
    }
}
