package com.orgscope.backend.modules.employee.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Null fields are left unchanged. {@code removeSupervisor} clears the supervisor link.
 */
public record UpdateEmployeeRequest(
        @Size(min = 1, max = 200) String fullName,
        @Email @Size(max = 320) String email,
        @Size(max = 120) String jobTitle,
        Long departmentId,
        Long supervisorId,
        Boolean removeSupervisor,
        Long positionId
) {

    public boolean clearSupervisor() {
        return Boolean.TRUE.equals(removeSupervisor);
    }
}
