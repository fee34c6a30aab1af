package com.orgscope.backend.modules.access.presentation;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.orgscope.backend.modules.access.application.UserScopeService;
import com.orgscope.backend.modules.access.presentation.dto.AssignScopeRequest;
import com.orgscope.backend.modules.access.presentation.dto.UserScopeResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/users/{userId}/scopes")
public class UserScopeController {

    private final UserScopeService userScopeService;

    public UserScopeController(UserScopeService userScopeService) {
        this.userScopeService = userScopeService;
    }

    @Operation(summary = "List active scopes", description = "Organizational scopes currently bound to the user.")
    @GetMapping
    public ResponseEntity<List<UserScopeResponse>> listScopes(@PathVariable("userId") Long userId) {
        return ResponseEntity.ok(userScopeService.listScopes(userId));
    }

    @Operation(summary = "Assign scope", description = "Binds a business group, company, branch or department scope to the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Scope assigned"),
            @ApiResponse(responseCode = "403", description = "Caller may not assign this scope"),
            @ApiResponse(responseCode = "404", description = "User or scope node not found"),
            @ApiResponse(responseCode = "409", description = "Scope already assigned"),
            @ApiResponse(responseCode = "422", description = "Scope type not permitted for the user's role")
    })
    @PostMapping
    public ResponseEntity<UserScopeResponse> assignScope(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody AssignScopeRequest request
    ) {
        UserScopeResponse response = userScopeService.assignScope(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Revoke scope")
    @DeleteMapping("/{scopeId}")
    public ResponseEntity<UserScopeResponse> revokeScope(
            @PathVariable("userId") Long userId,
            @PathVariable("scopeId") Long scopeId
    ) {
        return ResponseEntity.ok(userScopeService.revokeScope(userId, scopeId));
    }
}
