package com.orgscope.backend.modules.access.presentation;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.orgscope.backend.modules.access.application.EndpointCatalogService;
import com.orgscope.backend.modules.access.application.PermissionGrantService;
import com.orgscope.backend.modules.access.presentation.dto.EndpointResponse;
import com.orgscope.backend.modules.access.presentation.dto.PermissionGrantRequest;
import com.orgscope.backend.modules.access.presentation.dto.PermissionMatrixResponse;
import com.orgscope.backend.modules.access.presentation.dto.ReplacePermissionsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1")
public class PermissionController {

    private final PermissionGrantService permissionGrantService;
    private final EndpointCatalogService endpointCatalogService;

    public PermissionController(PermissionGrantService permissionGrantService,
            EndpointCatalogService endpointCatalogService) {
        this.permissionGrantService = permissionGrantService;
        this.endpointCatalogService = endpointCatalogService;
    }

    @Operation(summary = "Permission matrix", description = "Active endpoint overrides of the user as path -> method -> allowed.")
    @GetMapping("/users/{userId}/permissions")
    public ResponseEntity<PermissionMatrixResponse> getMatrix(@PathVariable("userId") Long userId) {
        return ResponseEntity.ok(permissionGrantService.getMatrix(userId));
    }

    @Operation(summary = "Replace permissions", description = "Atomically replaces every active override of the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Replaced"),
            @ApiResponse(responseCode = "403", description = "Caller may not manage permissions"),
            @ApiResponse(responseCode = "422", description = "Invalid path, method or duplicate entry")
    })
    @PutMapping("/users/{userId}/permissions")
    public ResponseEntity<PermissionMatrixResponse> replacePermissions(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody ReplacePermissionsRequest request
    ) {
        return ResponseEntity.ok(permissionGrantService.replacePermissions(userId, request));
    }

    @Operation(summary = "Set one permission")
    @PatchMapping("/users/{userId}/permissions")
    public ResponseEntity<PermissionMatrixResponse> upsertPermission(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody PermissionGrantRequest request
    ) {
        return ResponseEntity.ok(permissionGrantService.upsertPermission(userId, request));
    }

    @Operation(summary = "Revoke one permission")
    @DeleteMapping("/users/{userId}/permissions")
    public ResponseEntity<Void> revokePermission(
            @PathVariable("userId") Long userId,
            @RequestParam("path") String path,
            @RequestParam("method") String method
    ) {
        permissionGrantService.revokePermission(userId, path, method);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Endpoint catalog", description = "API endpoints that can be targeted by a permission override.")
    @GetMapping("/permissions/endpoints")
    public ResponseEntity<List<EndpointResponse>> listEndpoints() {
        return ResponseEntity.ok(endpointCatalogService.listEndpoints());
    }
}
