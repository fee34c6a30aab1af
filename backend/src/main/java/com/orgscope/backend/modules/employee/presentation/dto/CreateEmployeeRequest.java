package com.orgscope.backend.modules.employee.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * When a department is given and the branch is not, the branch is taken from the department.
 */
public record CreateEmployeeRequest(
        @NotNull Long companyId,
        Long branchId,
        Long departmentId,
        Long supervisorId,
        Long positionId,
        Long userId,
        @NotBlank @Size(max = 50) String employeeCode,
        @NotBlank @Size(max = 200) String fullName,
        @Email @Size(max = 320) String email,
        @Size(max = 120) String jobTitle
) {
}
