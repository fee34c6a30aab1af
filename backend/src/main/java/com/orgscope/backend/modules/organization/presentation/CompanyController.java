package com.orgscope.backend.modules.organization.presentation;

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
import com.orgscope.backend.modules.organization.application.CompanyService;
import com.orgscope.backend.modules.organization.presentation.dto.CompanyResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateCompanyRequest;
import com.orgscope.backend.modules.organization.presentation.dto.RenameOrgUnitRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/companies")
public class CompanyController {

    private final CompanyService companyService;

    public CompanyController(CompanyService companyService) {
        this.companyService = companyService;
    }

    @Operation(summary = "Create company")
    @PostMapping
    public ResponseEntity<CompanyResponse> createCompany(@Valid @RequestBody CreateCompanyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(companyService.createCompany(request));
    }

    @Operation(summary = "List companies")
    @GetMapping
    public ResponseEntity<PageResponse<CompanyResponse>> listCompanies(
            @RequestParam(name = "businessGroupId", required = false) Long businessGroupId,
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = "name") Pageable pageable
    ) {
        return ResponseEntity.ok(companyService.listCompanies(businessGroupId, keyword, includeInactive, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CompanyResponse> getCompany(@PathVariable("id") Long id) {
        return ResponseEntity.ok(companyService.getCompany(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<CompanyResponse> renameCompany(
            @PathVariable("id") Long id,
            @Valid @RequestBody RenameOrgUnitRequest request
    ) {
        return ResponseEntity.ok(companyService.renameCompany(id, request));
    }

    @Operation(summary = "Deactivate company", description = "Rejected while active branches, departments or employees remain.")
    @DeleteMapping("/{id}")
    public ResponseEntity<CompanyResponse> deactivateCompany(@PathVariable("id") Long id) {
        return ResponseEntity.ok(companyService.deactivateCompany(id));
    }
}
