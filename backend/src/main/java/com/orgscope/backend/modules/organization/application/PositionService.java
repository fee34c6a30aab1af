package com.orgscope.backend.modules.organization.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.orgscope.backend.global.common.PageResponse;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.access.application.AccessGuard;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.infrastructure.persistence.AccessSpecifications;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.domain.Position;
import com.orgscope.backend.modules.organization.domain.PositionHierarchyLevel;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.OrgSpecifications;
import com.orgscope.backend.modules.organization.infrastructure.persistence.PositionRepository;
import com.orgscope.backend.modules.organization.presentation.dto.CreatePositionRequest;
import com.orgscope.backend.modules.organization.presentation.dto.PositionResponse;
import com.orgscope.backend.modules.organization.presentation.dto.UpdatePositionRequest;

/**
 * Per-company position catalog. Positions are authorized at their company's coordinates.
 */
@Service
@Transactional
public class PositionService {

    private static final Logger log = LoggerFactory.getLogger(PositionService.class);

    private final PositionRepository positionRepository;
    private final CompanyRepository companyRepository;
    private final EmployeeRepository employeeRepository;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public PositionService(
            PositionRepository positionRepository,
            CompanyRepository companyRepository,
            EmployeeRepository employeeRepository,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.positionRepository = positionRepository;
        this.companyRepository = companyRepository;
        this.employeeRepository = employeeRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public PositionResponse createPosition(CreatePositionRequest request) {
        Company company = companyRepository.findById(request.companyId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
        if (!company.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "company.inactive");
        }
        accessGuard.require(AccessAction.CREATE, company.coordinates());

        Position position = new Position();
        position.setBusinessGroupId(company.getBusinessGroupId());
        position.setCompanyId(company.getId());
        position.setTitle(request.title().trim());
        position.setLevel(request.level());
        position.setHierarchyLevel(request.hierarchyLevel());
        position.setHierarchyWeight(weightOf(request.hierarchyLevel(), request.hierarchyWeight()));
        position.setDescription(request.description());
        position = positionRepository.saveAndFlush(position);
        log.info("Position {} ({}, weight {}) created in company {}", position.getId(), position.getHierarchyLevel(),
                position.getHierarchyWeight(), company.getId());
        return PositionResponse.from(position);
    }

    @Transactional(readOnly = true)
    public PositionResponse getPosition(Long id) {
        Position position = load(id);
        accessGuard.require(AccessAction.READ, position.coordinates());
        return PositionResponse.from(position);
    }

    @Transactional(readOnly = true)
    public PageResponse<PositionResponse> listPositions(Long companyId, PositionHierarchyLevel hierarchyLevel,
            String keyword, boolean includeInactive, Pageable pageable) {
        Specification<Position> search = Specification
                .where(OrgSpecifications.<Position>attributeEquals("companyId", companyId))
                .and(OrgSpecifications.attributeEquals("hierarchyLevel", hierarchyLevel))
                .and(OrgSpecifications.titleContains(keyword))
                .and(OrgSpecifications.activeOnly(includeInactive));
        Specification<Position> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                OrgSpecifications.POSITION_MAPPING, search);
        return PageResponse.from(positionRepository.findAll(spec, pageable), PositionResponse::from);
    }

    public PositionResponse updatePosition(Long id, UpdatePositionRequest request) {
        Position position = positionRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.UPDATE, position.coordinates());
        if (request.title() != null) {
            position.setTitle(request.title().trim());
        }
        if (request.level() != null) {
            position.setLevel(request.level());
        }
        if (request.description() != null) {
            position.setDescription(request.description());
        }
        if (request.hierarchyWeight() != null) {
            position.setHierarchyWeight(request.hierarchyWeight());
        }
        if (request.hierarchyLevel() != null && request.hierarchyLevel() != position.getHierarchyLevel()) {
            position.setHierarchyLevel(request.hierarchyLevel());
            if (request.hierarchyWeight() == null) {
                position.setHierarchyWeight(request.hierarchyLevel().defaultWeight());
            }
        }
        return PositionResponse.from(position);
    }

    public PositionResponse deactivatePosition(Long id) {
        Position position = positionRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, position.coordinates());
        if (!position.isActive()) {
            return PositionResponse.from(position);
        }
        if (employeeRepository.existsByPositionIdAndActiveTrue(id)) {
            throw new ActiveDescendantsException("position " + id + " is still held by active employees");
        }
        position.deactivate(OffsetDateTime.now(clock));
        log.info("Position {} deactivated", id);
        return PositionResponse.from(position);
    }

    static int weightOf(PositionHierarchyLevel level, Integer requested) {
        return requested != null ? requested : level.defaultWeight();
    }

    private Position load(Long id) {
        return positionRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "position.not_found", "position " + id + " not found");
    }
}
