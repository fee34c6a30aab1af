package com.orgscope.backend.modules.access.application;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.hierarchy.application.HierarchyValidator;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;
import com.orgscope.backend.modules.organization.domain.OrgPositioned;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BusinessGroupRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;

/**
 * Expands coordinates into the set of organizational nodes above and including the target, reading
 * the department chain from storage.
 */
@Component
public class OrgPathResolver {

    private final BusinessGroupRepository businessGroupRepository;
    private final CompanyRepository companyRepository;
    private final BranchRepository branchRepository;
    private final DepartmentRepository departmentRepository;
    private final HierarchyValidator hierarchyValidator;

    public OrgPathResolver(
            BusinessGroupRepository businessGroupRepository,
            CompanyRepository companyRepository,
            BranchRepository branchRepository,
            DepartmentRepository departmentRepository,
            HierarchyValidator hierarchyValidator
    ) {
        this.businessGroupRepository = businessGroupRepository;
        this.companyRepository = companyRepository;
        this.branchRepository = branchRepository;
        this.departmentRepository = departmentRepository;
        this.hierarchyValidator = hierarchyValidator;
    }

    /**
     * Department chain (innermost first), then branch, company and business group.
     */
    public Set<OrgNodeRef> pathOf(OrgCoordinates coordinates) {
        Set<OrgNodeRef> path = new LinkedHashSet<>();
        if (coordinates.departmentId() != null) {
            for (HierarchyNode node : hierarchyValidator.ancestorPath(HierarchyKind.DEPARTMENT, coordinates.departmentId())) {
                path.add(OrgNodeRef.department(node.id()));
            }
        }
        if (coordinates.branchId() != null) {
            path.add(OrgNodeRef.branch(coordinates.branchId()));
        }
        if (coordinates.companyId() != null) {
            path.add(OrgNodeRef.company(coordinates.companyId()));
        }
        if (coordinates.businessGroupId() != null) {
            path.add(OrgNodeRef.businessGroup(coordinates.businessGroupId()));
        }
        return path;
    }

    /**
     * The given department followed by every department below it.
     */
    public Set<Long> departmentSubtree(long departmentId) {
        Set<Long> ids = new LinkedHashSet<>();
        ids.add(departmentId);
        for (Long descendant : hierarchyValidator.descendants(HierarchyKind.DEPARTMENT, departmentId)) {
            ids.add(descendant);
        }
        return ids;
    }

    public Optional<Long> companyOfBranch(long branchId) {
        return branchRepository.findById(branchId).map(Branch::getCompanyId);
    }

    /**
     * Coordinates of a stored node; 404 when it does not exist.
     */
    public OrgCoordinates coordinatesOf(OrgNodeRef node) {
        Optional<? extends OrgPositioned> positioned = switch (node.type()) {
            case BUSINESS_GROUP -> businessGroupRepository.findById(node.id());
            case COMPANY -> companyRepository.findById(node.id());
            case BRANCH -> branchRepository.findById(node.id());
            case DEPARTMENT -> departmentRepository.findById(node.id());
        };
        return positioned
                .map(OrgPositioned::coordinates)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, node.type().tag() + ".not_found",
                        node + " not found"));
    }
}
