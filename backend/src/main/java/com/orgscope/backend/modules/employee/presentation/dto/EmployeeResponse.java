package com.orgscope.backend.modules.employee.presentation.dto;

import java.time.OffsetDateTime;

import com.orgscope.backend.modules.employee.domain.Employee;

public record EmployeeResponse(
        Long id,
        Long businessGroupId,
        Long companyId,
        Long branchId,
        Long departmentId,
        Long supervisorId,
        Long positionId,
        Long userId,
        String employeeCode,
        String fullName,
        String email,
        String jobTitle,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime deactivatedAt
) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(
                employee.getId(),
                employee.getBusinessGroupId(),
                employee.getCompanyId(),
                employee.getBranchId(),
                employee.getDepartmentId(),
                employee.getSupervisorId(),
                employee.getPositionId(),
                employee.getUserId(),
                employee.getEmployeeCode(),
                employee.getFullName(),
                employee.getEmail(),
                employee.getJobTitle(),
                employee.isActive(),
                employee.getCreatedAt(),
                employee.getDeactivatedAt());
    }
}
