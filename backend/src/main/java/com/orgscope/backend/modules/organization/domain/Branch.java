package com.orgscope.backend.modules.organization.domain;

import java.time.OffsetDateTime;

import com.orgscope.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Physical site of a company. At most one active branch per company carries the headquarters flag
 * (partial unique index {@code uq_branch_headquarters}).
 */
@Entity
@Table(name = "branch")
public class Branch extends AbstractAuditedEntity implements OrgPositioned {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "business_group_id", nullable = false, updatable = false)
    private Long businessGroupId;

    @Column(name = "company_id", nullable = false, updatable = false)
    private Long companyId;

    @Column(name = "code", nullable = false, length = 50)
    private String code;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "headquarters", nullable = false)
    private boolean headquarters;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    public Long getId() {
        return id;
    }

    public Long getBusinessGroupId() {
        return businessGroupId;
    }

    public void setBusinessGroupId(Long businessGroupId) {
        this.businessGroupId = businessGroupId;
    }

    public Long getCompanyId() {
        return companyId;
    }

    public void setCompanyId(Long companyId) {
        this.companyId = companyId;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isHeadquarters() {
        return headquarters;
    }

    public void setHeadquarters(boolean headquarters) {
        this.headquarters = headquarters;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public void deactivate(OffsetDateTime at) {
        this.active = false;
        this.headquarters = false;
        this.deactivatedAt = at;
    }

    @Override
    public OrgCoordinates coordinates() {
        return OrgCoordinates.ofBranch(businessGroupId, companyId, id);
    }
}
