package com.orgscope.backend.modules.employee.presentation.dto;

import java.util.List;

/**
 * An employee with its subordinates, recursively.
 */
public record TeamTreeResponse(
        EmployeeResponse employee,
        List<TeamTreeResponse> subordinates
) {
}
