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
import com.orgscope.backend.modules.organization.application.BranchService;
import com.orgscope.backend.modules.organization.presentation.dto.BranchResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateBranchRequest;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateBranchRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/branches")
public class BranchController {

    private final BranchService branchService;

    public BranchController(BranchService branchService) {
        this.branchService = branchService;
    }

    @Operation(summary = "Create branch")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Duplicate code or second active headquarters")
    })
    @PostMapping
    public ResponseEntity<BranchResponse> createBranch(@Valid @RequestBody CreateBranchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(branchService.createBranch(request));
    }

    @Operation(summary = "List branches")
    @GetMapping
    public ResponseEntity<PageResponse<BranchResponse>> listBranches(
            @RequestParam(name = "companyId", required = false) Long companyId,
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = "name") Pageable pageable
    ) {
        return ResponseEntity.ok(branchService.listBranches(companyId, keyword, includeInactive, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BranchResponse> getBranch(@PathVariable("id") Long id) {
        return ResponseEntity.ok(branchService.getBranch(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BranchResponse> updateBranch(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateBranchRequest request
    ) {
        return ResponseEntity.ok(branchService.updateBranch(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BranchResponse> deactivateBranch(@PathVariable("id") Long id) {
        return ResponseEntity.ok(branchService.deactivateBranch(id));
    }
}
