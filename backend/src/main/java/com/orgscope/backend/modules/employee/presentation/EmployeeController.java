package com.orgscope.backend.modules.employee.presentation;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.orgscope.backend.global.common.PageResponse;
import com.orgscope.backend.modules.employee.application.EmployeeService;
import com.orgscope.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.orgscope.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.orgscope.backend.modules.employee.presentation.dto.TeamTreeResponse;
import com.orgscope.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/employees")
public class EmployeeController {

    private final EmployeeService employeeService;

    public EmployeeController(EmployeeService employeeService) {
        this.employeeService = employeeService;
    }

    @Operation(summary = "Create employee")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Employee code already used in the company"),
            @ApiResponse(responseCode = "422", description = "Supervisor or department in another company")
    })
    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@Valid @RequestBody CreateEmployeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(employeeService.createEmployee(request));
    }

    @Operation(summary = "List employees")
    @GetMapping
    public ResponseEntity<PageResponse<EmployeeResponse>> listEmployees(
            @RequestParam(name = "companyId", required = false) Long companyId,
            @RequestParam(name = "departmentId", required = false) Long departmentId,
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = "fullName") Pageable pageable
    ) {
        return ResponseEntity.ok(employeeService.listEmployees(companyId, departmentId, keyword, includeInactive, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmployeeResponse> getEmployee(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.getEmployee(id));
    }

    @Operation(summary = "Update employee", description = "Updates details, department or supervisor.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "422", description = "Supervisor change would create a cycle or cross companies")
    })
    @PatchMapping("/{id}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateEmployeeRequest request
    ) {
        return ResponseEntity.ok(employeeService.updateEmployee(id, request));
    }

    @Operation(summary = "Deactivate employee", description = "Rejected while active subordinates remain.")
    @DeleteMapping("/{id}")
    public ResponseEntity<EmployeeResponse> deactivateEmployee(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.deactivateEmployee(id));
    }

    @Operation(summary = "Direct subordinates")
    @GetMapping("/{id}/subordinates")
    public ResponseEntity<List<EmployeeResponse>> listSubordinates(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.listSubordinates(id));
    }

    @Operation(summary = "Team tree", description = "The employee with all subordinates, nested.")
    @GetMapping("/{id}/team-tree")
    public ResponseEntity<TeamTreeResponse> teamTree(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.teamTree(id));
    }

    @Operation(summary = "Supervisor chain", description = "From the direct supervisor up to the top of the chain.")
    @GetMapping("/{id}/supervisor-chain")
    public ResponseEntity<List<EmployeeResponse>> supervisorChain(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.supervisorChain(id));
    }
}
