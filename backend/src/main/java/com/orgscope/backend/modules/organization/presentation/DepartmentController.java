package com.orgscope.backend.modules.organization.presentation;

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
import com.orgscope.backend.modules.organization.application.DepartmentService;
import com.orgscope.backend.modules.organization.presentation.dto.CreateDepartmentRequest;
import com.orgscope.backend.modules.organization.presentation.dto.DepartmentResponse;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateDepartmentRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/departments")
public class DepartmentController {

    private final DepartmentService departmentService;

    public DepartmentController(DepartmentService departmentService) {
        this.departmentService = departmentService;
    }

    @Operation(summary = "Create department")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Code already used in the company"),
            @ApiResponse(responseCode = "422", description = "Parent in another company, or chain deeper than five levels")
    })
    @PostMapping
    public ResponseEntity<DepartmentResponse> createDepartment(@Valid @RequestBody CreateDepartmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(departmentService.createDepartment(request));
    }

    @Operation(summary = "List departments")
    @GetMapping
    public ResponseEntity<PageResponse<DepartmentResponse>> listDepartments(
            @RequestParam(name = "companyId", required = false) Long companyId,
            @RequestParam(name = "branchId", required = false) Long branchId,
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = "name") Pageable pageable
    ) {
        return ResponseEntity.ok(departmentService.listDepartments(companyId, branchId, keyword, includeInactive, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DepartmentResponse> getDepartment(@PathVariable("id") Long id) {
        return ResponseEntity.ok(departmentService.getDepartment(id));
    }

    @Operation(summary = "Update department", description = "Renames and/or moves the department under a new parent.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "422", description = "Move would create a cycle, cross companies or exceed five levels")
    })
    @PatchMapping("/{id}")
    public ResponseEntity<DepartmentResponse> updateDepartment(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateDepartmentRequest request
    ) {
        return ResponseEntity.ok(departmentService.updateDepartment(id, request));
    }

    @Operation(summary = "Deactivate department", description = "Rejected while active sub-departments or employees remain.")
    @DeleteMapping("/{id}")
    public ResponseEntity<DepartmentResponse> deactivateDepartment(@PathVariable("id") Long id) {
        return ResponseEntity.ok(departmentService.deactivateDepartment(id));
    }

    @Operation(summary = "Direct sub-departments")
    @GetMapping("/{id}/children")
    public ResponseEntity<List<DepartmentResponse>> listChildren(@PathVariable("id") Long id) {
        return ResponseEntity.ok(departmentService.listChildren(id));
    }

    @Operation(summary = "Hierarchy path", description = "The department followed by its ancestors up to the root.")
    @GetMapping("/{id}/hierarchy-path")
    public ResponseEntity<List<DepartmentResponse>> hierarchyPath(@PathVariable("id") Long id) {
        return ResponseEntity.ok(departmentService.hierarchyPath(id));
    }

    @Operation(summary = "All sub-departments", description = "Breadth-first, limited to departments the caller may read.")
    @GetMapping("/{id}/descendants")
    public ResponseEntity<List<DepartmentResponse>> listDescendants(@PathVariable("id") Long id) {
        return ResponseEntity.ok(departmentService.listDescendants(id));
    }
}
