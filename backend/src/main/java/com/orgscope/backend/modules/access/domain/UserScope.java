package com.orgscope.backend.modules.access.domain;

import java.time.OffsetDateTime;

import com.orgscope.backend.global.jpa.AbstractAuditedEntity;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;
import com.orgscope.backend.modules.organization.domain.OrgUnitTypeConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "user_scope")
public class UserScope extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Convert(converter = OrgUnitTypeConverter.class)
    @Column(name = "scope_type", nullable = false, updatable = false, length = 30)
    private OrgUnitType scopeType;

    @Column(name = "scope_id", nullable = false, updatable = false)
    private Long scopeId;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    protected UserScope() {
    }

    public UserScope(Long userId, OrgNodeRef node) {
        this.userId = userId;
        this.scopeType = node.type();
        this.scopeId = node.id();
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public OrgUnitType getScopeType() {
        return scopeType;
    }

    public Long getScopeId() {
        return scopeId;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public OrgNodeRef toNodeRef() {
        return new OrgNodeRef(scopeType, scopeId);
    }

    public void revoke(OffsetDateTime at) {
        this.active = false;
        this.revokedAt = at;
    }
}
