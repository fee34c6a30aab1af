package com.orgscope.backend.modules.access.domain;

import java.time.OffsetDateTime;

import com.orgscope.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Explicit allow or deny of one endpoint (path + HTTP method) for one user. At most one row per
 * user, path and method is active ({@code revoked_at} null).
 */
@Entity
@Table(name = "permission_grant")
public class PermissionGrant extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "resource_path", nullable = false, updatable = false, length = 255)
    private String resourcePath;

    @Column(name = "http_method", nullable = false, updatable = false, length = 10)
    private String httpMethod;

    @Column(name = "allowed", nullable = false, updatable = false)
    private boolean allowed;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    protected PermissionGrant() {
    }

    public PermissionGrant(Long userId, String resourcePath, String httpMethod, boolean allowed) {
        this.userId = userId;
        this.resourcePath = resourcePath;
        this.httpMethod = httpMethod;
        this.allowed = allowed;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public String getHttpMethod() {
        return httpMethod;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public boolean isActive() {
        return revokedAt == null;
    }
}
