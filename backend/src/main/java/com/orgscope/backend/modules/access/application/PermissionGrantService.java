package com.orgscope.backend.modules.access.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

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
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.access.domain.PermissionGrant;
import com.orgscope.backend.modules.access.domain.UserAccount;
import com.orgscope.backend.modules.access.infrastructure.persistence.PermissionGrantRepository;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserAccountRepository;
import com.orgscope.backend.modules.access.presentation.dto.PermissionGrantRequest;
import com.orgscope.backend.modules.access.presentation.dto.PermissionMatrixResponse;
import com.orgscope.backend.modules.access.presentation.dto.ReplacePermissionsRequest;

/**
 * Management of per-endpoint overrides. Every mutation locks the target user row first, so bulk
 * replacements for the same user serialize and each one either lands completely or not at all.
 */
@Service
@Transactional
public class PermissionGrantService {

    private static final Logger log = LoggerFactory.getLogger(PermissionGrantService.class);

    static final String ACTIVE_GRANT_CONSTRAINT = "uq_permission_grant_active";
    private static final String API_PREFIX = "/api/";

    private final PermissionGrantRepository permissionGrantRepository;
    private final UserAccountRepository userAccountRepository;
    private final AccessGuard accessGuard;
    private final AccessPolicyProperties properties;
    private final Clock clock;

    public PermissionGrantService(
            PermissionGrantRepository permissionGrantRepository,
            UserAccountRepository userAccountRepository,
            AccessGuard accessGuard,
            AccessPolicyProperties properties,
            Clock clock
    ) {
        this.permissionGrantRepository = permissionGrantRepository;
        this.userAccountRepository = userAccountRepository;
        this.accessGuard = accessGuard;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PermissionMatrixResponse getMatrix(Long userId) {
        AccessPrincipal actor = accessGuard.currentPrincipal();
        if (!actor.userId().equals(userId) && actor.roleLevel() > properties.permissionAdminMaxLevel()) {
            throw new AuthorizationDeniedException("Permissions of other users are not visible");
        }
        userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found"));
        return toMatrix(userId, permissionGrantRepository.findByUserIdAndRevokedAtIsNullOrderByResourcePathAscHttpMethodAsc(userId));
    }

    /**
     * Revokes every active override of the user and installs {@code request.grants()} in their place.
     */
    public PermissionMatrixResponse replacePermissions(Long userId, ReplacePermissionsRequest request) {
        AccessPrincipal actor = accessGuard.requireRoleLevelAtMost(properties.permissionAdminMaxLevel());
        lockUser(userId);

        List<PermissionGrant> grants = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (PermissionGrantRequest entry : request.grants()) {
            PermissionGrant grant = toGrant(userId, entry);
            if (!seen.add(grant.getHttpMethod() + " " + grant.getResourcePath())) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "permission.duplicate_entry",
                        "Duplicate entry for " + grant.getHttpMethod() + " " + grant.getResourcePath());
            }
            grants.add(grant);
        }

        int revoked = permissionGrantRepository.revokeAllActive(userId, OffsetDateTime.now(clock));
        List<PermissionGrant> saved = saveGrants(grants);
        log.info("Permissions of user {} replaced by user {}: {} revoked, {} granted",
                userId, actor.userId(), revoked, saved.size());
        return toMatrix(userId, saved);
    }

    /**
     * Creates or replaces the override for one path and method.
     */
    public PermissionMatrixResponse upsertPermission(Long userId, PermissionGrantRequest request) {
        AccessPrincipal actor = accessGuard.requireRoleLevelAtMost(properties.permissionAdminMaxLevel());
        lockUser(userId);
        PermissionGrant grant = toGrant(userId, request);
        permissionGrantRepository.revokeActive(userId, grant.getResourcePath(), grant.getHttpMethod(),
                OffsetDateTime.now(clock));
        saveGrants(List.of(grant));
        log.info("Permission {} {} set to {} for user {} by user {}", grant.getHttpMethod(), grant.getResourcePath(),
                grant.isAllowed(), userId, actor.userId());
        return toMatrix(userId, permissionGrantRepository.findByUserIdAndRevokedAtIsNullOrderByResourcePathAscHttpMethodAsc(userId));
    }

    public void revokePermission(Long userId, String resourcePath, String httpMethod) {
        AccessPrincipal actor = accessGuard.requireRoleLevelAtMost(properties.permissionAdminMaxLevel());
        lockUser(userId);
        String path = PermissionOverride.normalizePath(resourcePath);
        String method = PermissionOverride.normalizeMethod(httpMethod);
        int revoked = permissionGrantRepository.revokeActive(userId, path, method, OffsetDateTime.now(clock));
        if (revoked == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "permission.not_found",
                    "No active override for " + method + " " + path);
        }
        log.info("Permission {} {} revoked for user {} by user {}", method, path, userId, actor.userId());
    }

    private List<PermissionGrant> saveGrants(List<PermissionGrant> grants) {
        try {
            List<PermissionGrant> saved = permissionGrantRepository.saveAll(grants);
            permissionGrantRepository.flush();
            return saved;
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, ACTIVE_GRANT_CONSTRAINT)) {
                throw new UniquenessConflictException("permission.duplicate_grant",
                        "A concurrent change already granted one of these endpoints");
            }
            throw ex;
        }
    }

    private UserAccount lockUser(Long userId) {
        return userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found"));
    }

    private static PermissionGrant toGrant(Long userId, PermissionGrantRequest request) {
        String path = PermissionOverride.normalizePath(request.resourcePath());
        String method = PermissionOverride.normalizeMethod(request.httpMethod());
        if (!path.startsWith(API_PREFIX)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "permission.invalid_path",
                    "Resource path must start with " + API_PREFIX + ": " + path);
        }
        if (PermissionOverride.isTemplated(path)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "permission.templated_path",
                    "Grants match concrete request paths; use the base path instead of " + path);
        }
        if (!PermissionOverride.SUPPORTED_METHODS.contains(method)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "permission.invalid_method",
                    "Unsupported HTTP method: " + method);
        }
        return new PermissionGrant(userId, path, method, request.allowed());
    }

    private static PermissionMatrixResponse toMatrix(Long userId, List<PermissionGrant> grants) {
        Map<String, Map<String, Boolean>> matrix = new TreeMap<>();
        for (PermissionGrant grant : grants) {
            matrix.computeIfAbsent(grant.getResourcePath(), path -> new TreeMap<>())
                    .put(grant.getHttpMethod(), grant.isAllowed());
        }
        return new PermissionMatrixResponse(userId, matrix);
    }
}
