package com.orgscope.backend.modules.organization.domain;

import java.time.OffsetDateTime;

import com.orgscope.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Job title in a company's position catalog. {@code hierarchyWeight} runs from 0 (top) to 100
 * (bottom) and orders employees in team views.
 */
@Entity
@Table(name = "job_position")
public class Position extends AbstractAuditedEntity implements OrgPositioned {

    public static final int DEFAULT_WEIGHT = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "business_group_id", nullable = false, updatable = false)
    private Long businessGroupId;

    @Column(name = "company_id", nullable = false, updatable = false)
    private Long companyId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "level", length = 50)
    private String level;

    @Enumerated(EnumType.STRING)
    @Column(name = "hierarchy_level", nullable = false, length = 20)
    private PositionHierarchyLevel hierarchyLevel;

    @Column(name = "hierarchy_weight", nullable = false)
    private int hierarchyWeight = DEFAULT_WEIGHT;

    @Column(name = "description", length = 1000)
    private String description;

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

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public PositionHierarchyLevel getHierarchyLevel() {
        return hierarchyLevel;
    }

    public void setHierarchyLevel(PositionHierarchyLevel hierarchyLevel) {
        this.hierarchyLevel = hierarchyLevel;
    }

    public int getHierarchyWeight() {
        return hierarchyWeight;
    }

    public void setHierarchyWeight(int hierarchyWeight) {
        this.hierarchyWeight = hierarchyWeight;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public void deactivate(OffsetDateTime at) {
        this.active = false;
        this.deactivatedAt = at;
    }

    @Override
    public OrgCoordinates coordinates() {
        return OrgCoordinates.ofCompany(businessGroupId, companyId);
    }
}
