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
import com.orgscope.backend.modules.organization.application.BusinessGroupService;
import com.orgscope.backend.modules.organization.presentation.dto.BusinessGroupResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateBusinessGroupRequest;
import com.orgscope.backend.modules.organization.presentation.dto.RenameOrgUnitRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/business-groups")
public class BusinessGroupController {

    private final BusinessGroupService businessGroupService;

    public BusinessGroupController(BusinessGroupService businessGroupService) {
        this.businessGroupService = businessGroupService;
    }

    @Operation(summary = "Create business group")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "Only unscoped administrators may create tenant roots"),
            @ApiResponse(responseCode = "409", description = "Code already used")
    })
    @PostMapping
    public ResponseEntity<BusinessGroupResponse> createBusinessGroup(@Valid @RequestBody CreateBusinessGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(businessGroupService.createBusinessGroup(request));
    }

    @Operation(summary = "List business groups", description = "Only groups visible to the caller are returned.")
    @GetMapping
    public ResponseEntity<PageResponse<BusinessGroupResponse>> listBusinessGroups(
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = "name") Pageable pageable
    ) {
        return ResponseEntity.ok(businessGroupService.listBusinessGroups(keyword, includeInactive, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BusinessGroupResponse> getBusinessGroup(@PathVariable("id") Long id) {
        return ResponseEntity.ok(businessGroupService.getBusinessGroup(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BusinessGroupResponse> renameBusinessGroup(
            @PathVariable("id") Long id,
            @Valid @RequestBody RenameOrgUnitRequest request
    ) {
        return ResponseEntity.ok(businessGroupService.renameBusinessGroup(id, request));
    }

    @Operation(summary = "Deactivate business group", description = "Rejected while active companies remain.")
    @DeleteMapping("/{id}")
    public ResponseEntity<BusinessGroupResponse> deactivateBusinessGroup(@PathVariable("id") Long id) {
        return ResponseEntity.ok(businessGroupService.deactivateBusinessGroup(id));
    }
}
