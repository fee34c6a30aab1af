package com.orgscope.backend.modules.employee.domain;

import java.time.OffsetDateTime;

import com.orgscope.backend.global.jpa.AbstractAuditedEntity;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgPositioned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Employee placed in a company and optionally a branch and department. The supervisor, the
 * catalog position and the linked user account are stored as plain ids.
 */
@Entity
@Table(name = "employee")
public class Employee extends AbstractAuditedEntity implements OrgPositioned {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "business_group_id", nullable = false, updatable = false)
    private Long businessGroupId;

    @Column(name = "company_id", nullable = false, updatable = false)
    private Long companyId;

    @Column(name = "branch_id")
    private Long branchId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "supervisor_id")
    private Long supervisorId;

    @Column(name = "position_id")
    private Long positionId;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "employee_code", nullable = false, length = 50)
    private String employeeCode;

    @Column(name = "full_name", nullable = false, length = 200)
    private String fullName;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "job_title", length = 120)
    private String jobTitle;

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

    public Long getBranchId() {
        return branchId;
    }

    public void setBranchId(Long branchId) {
        this.branchId = branchId;
    }

    public Long getDepartmentId() {
        return departmentId;
    }

    public void setDepartmentId(Long departmentId) {
        this.departmentId = departmentId;
    }

    public Long getSupervisorId() {
        return supervisorId;
    }

    public void setSupervisorId(Long supervisorId) {
        this.supervisorId = supervisorId;
    }

    public Long getPositionId() {
        return positionId;
    }

    public void setPositionId(Long positionId) {
        this.positionId = positionId;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getEmployeeCode() {
        return employeeCode;
    }

    public void setEmployeeCode(String employeeCode) {
        this.employeeCode = employeeCode;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public void setJobTitle(String jobTitle) {
        this.jobTitle = jobTitle;
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
        return new OrgCoordinates(businessGroupId, companyId, branchId, departmentId, userId);
    }
}
