package com.orgscope.backend.modules.access.application;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;
import com.orgscope.backend.modules.access.domain.PermissionGrant;
import com.orgscope.backend.modules.access.infrastructure.persistence.PermissionGrantRepository;

/**
 * Per-user, per-endpoint allow or deny that overrides role and scope.
 *
 * <p>Lookup order for a request path and method:</p>
 * <ol>
 *     <li>the exact path, trailing slash removed;</li>
 *     <li>the base path, i.e. the first {@code basePathSegments} segments
 *     ({@code /api/v1/employees/7/subordinates} becomes {@code /api/v1/employees});</li>
 *     <li>nothing, and the decision falls through to the scope check.</li>
 * </ol>
 *
 * <p>A match is final for point checks. For list reads an allow replaces the role's READ check
 * only: the rows stay bounded by the caller's scopes, or by the caller's own records when the
 * caller has no scope and no unrestricted role (see {@link AccessFilter#buildGrantedFilter}).
 * A deny turns the list into a 403.</p>
 */
@Component
public class PermissionOverride implements AccessVoter {

    public static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final PermissionGrantRepository permissionGrantRepository;
    private final int basePathSegments;

    public PermissionOverride(PermissionGrantRepository permissionGrantRepository, AccessPolicyProperties properties) {
        this.permissionGrantRepository = permissionGrantRepository;
        this.basePathSegments = properties.basePathSegments();
    }

    public Optional<Boolean> lookup(Long userId, String resourcePath, String method) {
        if (userId == null || resourcePath == null || method == null) {
            return Optional.empty();
        }
        String normalizedMethod = normalizeMethod(method);
        String path = normalizePath(resourcePath);
        Optional<Boolean> exact = find(userId, path, normalizedMethod);
        if (exact.isPresent()) {
            return exact;
        }
        String base = basePath(path, basePathSegments);
        if (base.equals(path)) {
            return Optional.empty();
        }
        return find(userId, base, normalizedMethod);
    }

    @Override
    public AccessVerdict vote(AccessRequest request) {
        if (!request.hasEndpoint()) {
            return AccessVerdict.ABSTAIN;
        }
        return lookup(request.principal().userId(), request.resourcePath(), request.httpMethod())
                .map(allowed -> allowed ? AccessVerdict.ALLOW : AccessVerdict.DENY)
                .orElse(AccessVerdict.ABSTAIN);
    }

    private Optional<Boolean> find(Long userId, String path, String method) {
        return permissionGrantRepository
                .findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(userId, path, method)
                .map(PermissionGrant::isAllowed);
    }

    public static String normalizePath(String path) {
        String trimmed = path.trim();
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            trimmed = trimmed.substring(0, query);
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Whether {@code path} still contains an MVC template variable such as {@code {id}}.
     */
    public static boolean isTemplated(String path) {
        return path.indexOf('{') >= 0 || path.indexOf('}') >= 0;
    }

    public static String normalizeMethod(String method) {
        return method.trim().toUpperCase(Locale.ROOT);
    }

    public static String basePath(String normalizedPath, int segments) {
        String[] parts = normalizedPath.split("/");
        // parts[0] is the empty string before the leading slash
        if (parts.length - 1 <= segments) {
            return normalizedPath;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= segments; i++) {
            sb.append('/').append(parts[i]);
        }
        return sb.toString();
    }
}
