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
import com.orgscope.backend.modules.organization.application.PositionService;
import com.orgscope.backend.modules.organization.domain.PositionHierarchyLevel;
import com.orgscope.backend.modules.organization.presentation.dto.CreatePositionRequest;
import com.orgscope.backend.modules.organization.presentation.dto.PositionResponse;
import com.orgscope.backend.modules.organization.presentation.dto.UpdatePositionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/positions")
public class PositionController {

    private final PositionService positionService;

    public PositionController(PositionService positionService) {
        this.positionService = positionService;
    }

    @Operation(summary = "Create position")
    @PostMapping
    public ResponseEntity<PositionResponse> createPosition(@Valid @RequestBody CreatePositionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(positionService.createPosition(request));
    }

    @Operation(summary = "List positions, highest in the hierarchy first")
    @GetMapping
    public ResponseEntity<PageResponse<PositionResponse>> listPositions(
            @RequestParam(name = "companyId", required = false) Long companyId,
            @RequestParam(name = "hierarchyLevel", required = false) PositionHierarchyLevel hierarchyLevel,
            @RequestParam(name = "keyword", required = false) String keyword,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @PageableDefault(size = 20, sort = {"hierarchyWeight", "title"}) Pageable pageable
    ) {
        return ResponseEntity.ok(positionService.listPositions(companyId, hierarchyLevel, keyword, includeInactive,
                pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable("id") Long id) {
        return ResponseEntity.ok(positionService.getPosition(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PositionResponse> updatePosition(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdatePositionRequest request
    ) {
        return ResponseEntity.ok(positionService.updatePosition(id, request));
    }

    @Operation(summary = "Deactivate position")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deactivated"),
            @ApiResponse(responseCode = "409", description = "Active employees still hold the position")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<PositionResponse> deactivatePosition(@PathVariable("id") Long id) {
        return ResponseEntity.ok(positionService.deactivatePosition(id));
    }
}
