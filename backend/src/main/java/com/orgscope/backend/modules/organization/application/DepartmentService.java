package com.orgscope.backend.modules.organization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.orgscope.backend.global.common.PageResponse;
import com.orgscope.backend.global.error.ConstraintViolations;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.error.UniquenessConflictException;
import com.orgscope.backend.modules.access.application.AccessGuard;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPredicate;
import com.orgscope.backend.modules.access.infrastructure.persistence.AccessSpecifications;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.application.HierarchyValidator;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.TenantMismatchException;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.domain.Department;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.OrgSpecifications;
import com.orgscope.backend.modules.organization.presentation.dto.CreateDepartmentRequest;
import com.orgscope.backend.modules.organization.presentation.dto.DepartmentResponse;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateDepartmentRequest;

/**
 * Department lifecycle and tree reads. Every parent change first locks the owning company row, which
 * serializes edge changes within one tenant, then locks the department and the new parent and
 * validates the edge inside the same transaction before writing it. Lock order is company, branch,
 * department.
 *
 * <p>A department always shares its parent's branch (both null for corporate departments).</p>
 */
@Service
@Transactional
public class DepartmentService {

    private static final Logger log = LoggerFactory.getLogger(DepartmentService.class);

    static final String CODE_CONSTRAINT = "uq_department_company_code";

    private final DepartmentRepository departmentRepository;
    private final CompanyRepository companyRepository;
    private final BranchRepository branchRepository;
    private final EmployeeRepository employeeRepository;
    private final HierarchyValidator hierarchyValidator;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public DepartmentService(
            DepartmentRepository departmentRepository,
            CompanyRepository companyRepository,
            BranchRepository branchRepository,
            EmployeeRepository employeeRepository,
            HierarchyValidator hierarchyValidator,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.departmentRepository = departmentRepository;
        this.companyRepository = companyRepository;
        this.branchRepository = branchRepository;
        this.employeeRepository = employeeRepository;
        this.hierarchyValidator = hierarchyValidator;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public DepartmentResponse createDepartment(CreateDepartmentRequest request) {
        Company company = (request.parentId() != null
                ? companyRepository.findByIdForUpdate(request.companyId())
                : companyRepository.findById(request.companyId()))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
        if (!company.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "company.inactive");
        }
        Long branchId = request.branchId();
        if (branchId != null) {
            requireBranchOfCompany(branchId, company);
        }

        Department parent = null;
        if (request.parentId() != null) {
            hierarchyValidator.lockEdge(HierarchyKind.DEPARTMENT, null, request.parentId());
            hierarchyValidator.validateEdge(HierarchyKind.DEPARTMENT,
                    HierarchyNode.unsaved(company.getId(), company.getBusinessGroupId()), request.parentId());
            parent = load(request.parentId());
            if (!parent.isActive()) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "department.parent_inactive");
            }
            if (branchId == null) {
                branchId = parent.getBranchId();
            } else if (!branchId.equals(parent.getBranchId())) {
                throw branchMismatch(branchId, parent);
            }
        }

        OrgCoordinates placement = parent != null
                ? parent.coordinates()
                : branchId != null
                        ? OrgCoordinates.ofBranch(company.getBusinessGroupId(), company.getId(), branchId)
                        : company.coordinates();
        accessGuard.require(AccessAction.CREATE, placement);

        Department department = new Department();
        department.setBusinessGroupId(company.getBusinessGroupId());
        department.setCompanyId(company.getId());
        department.setBranchId(branchId);
        department.setParentId(request.parentId());
        department.setCode(request.code().trim());
        department.setName(request.name().trim());
        department.setDescription(request.description());
        department = saveAndFlush(department);
        log.info("Department {} ({}) created in company {} under parent {}", department.getId(),
                department.getCode(), company.getId(), department.getParentId());
        return DepartmentResponse.from(department);
    }

    public DepartmentResponse updateDepartment(Long id, UpdateDepartmentRequest request) {
        Long newParentId = request.detach() ? null : request.parentId();
        boolean reparent = request.detach() || request.parentId() != null;

        if (reparent) {
            Long companyId = departmentRepository.findCompanyIdById(id).orElseThrow(() -> notFound(id));
            lockCompany(companyId);
            hierarchyValidator.lockEdge(HierarchyKind.DEPARTMENT, id, newParentId);
        } else {
            departmentRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        }
        Department department = load(id);
        accessGuard.require(AccessAction.UPDATE, department.coordinates());

        if (reparent && !Objects.equals(department.getParentId(), newParentId)) {
            hierarchyValidator.validateEdge(HierarchyKind.DEPARTMENT, id, newParentId);
            if (newParentId != null) {
                Department parent = load(newParentId);
                if (!parent.isActive()) {
                    throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "department.parent_inactive");
                }
                if (!Objects.equals(parent.getBranchId(), department.getBranchId())) {
                    throw branchMismatch(department.getBranchId(), parent);
                }
                accessGuard.require(AccessAction.UPDATE, parent.coordinates());
            }
            log.info("Department {} moved from parent {} to {}", id, department.getParentId(), newParentId);
            department.setParentId(newParentId);
        }
        if (request.name() != null) {
            department.setName(request.name().trim());
        }
        if (request.description() != null) {
            department.setDescription(request.description());
        }
        return DepartmentResponse.from(department);
    }

    public DepartmentResponse deactivateDepartment(Long id) {
        Department department = departmentRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, department.coordinates());
        if (!department.isActive()) {
            return DepartmentResponse.from(department);
        }
        hierarchyValidator.validateDeactivation(HierarchyKind.DEPARTMENT, id);
        if (employeeRepository.existsByDepartmentIdAndActiveTrue(id)) {
            throw new ActiveDescendantsException("department " + id + " still has active employees");
        }
        department.deactivate(OffsetDateTime.now(clock));
        log.info("Department {} deactivated", id);
        return DepartmentResponse.from(department);
    }

    @Transactional(readOnly = true)
    public DepartmentResponse getDepartment(Long id) {
        Department department = load(id);
        accessGuard.require(AccessAction.READ, department.coordinates());
        return DepartmentResponse.from(department);
    }

    @Transactional(readOnly = true)
    public PageResponse<DepartmentResponse> listDepartments(Long companyId, Long branchId, String keyword,
            boolean includeInactive, Pageable pageable) {
        Specification<Department> search = Specification
                .where(OrgSpecifications.<Department>attributeEquals("companyId", companyId))
                .and(OrgSpecifications.attributeEquals("branchId", branchId))
                .and(OrgSpecifications.keyword(keyword))
                .and(OrgSpecifications.activeOnly(includeInactive));
        Specification<Department> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                OrgSpecifications.DEPARTMENT_MAPPING, search);
        return PageResponse.from(departmentRepository.findAll(spec, pageable), DepartmentResponse::from);
    }

    @Transactional(readOnly = true)
    public List<DepartmentResponse> listChildren(Long id) {
        Department department = load(id);
        accessGuard.require(AccessAction.READ, department.coordinates());
        AccessPredicate visible = accessGuard.listFilter();
        return departmentRepository.findByParentIdOrderByNameAsc(id).stream()
                .filter(child -> visible.test(child.coordinates()))
                .map(DepartmentResponse::from)
                .toList();
    }

    /**
     * The department followed by its ancestors up to the corporate root.
     */
    @Transactional(readOnly = true)
    public List<DepartmentResponse> hierarchyPath(Long id) {
        Department department = load(id);
        accessGuard.require(AccessAction.READ, department.coordinates());
        List<Long> ids = hierarchyValidator.ancestorPath(HierarchyKind.DEPARTMENT, id).stream()
                .map(HierarchyNode::id)
                .toList();
        return loadInOrder(ids).stream().map(DepartmentResponse::from).toList();
    }

    /**
     * Every department below {@code id}, breadth-first, limited to what the caller may read.
     */
    @Transactional(readOnly = true)
    public List<DepartmentResponse> listDescendants(Long id) {
        Department department = load(id);
        accessGuard.require(AccessAction.READ, department.coordinates());
        AccessPredicate visible = accessGuard.listFilter();
        List<Long> ids = new ArrayList<>();
        hierarchyValidator.descendants(HierarchyKind.DEPARTMENT, id).forEach(ids::add);
        return loadInOrder(ids).stream()
                .filter(descendant -> visible.test(descendant.coordinates()))
                .map(DepartmentResponse::from)
                .toList();
    }

    private List<Department> loadInOrder(List<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<Long, Department> byId = departmentRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Department::getId, Function.identity()));
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    private void lockCompany(Long companyId) {
        companyRepository.findByIdForUpdate(companyId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
    }

    /**
     * Locks the branch so that a concurrent deactivation either sees the new department or rejects it.
     */
    private void requireBranchOfCompany(Long branchId, Company company) {
        Branch branch = branchRepository.findByIdForUpdate(branchId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "branch.not_found"));
        if (!branch.getCompanyId().equals(company.getId())) {
            throw new TenantMismatchException("branch " + branchId + " does not belong to company " + company.getId());
        }
        if (!branch.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "branch.inactive");
        }
    }

    private Department saveAndFlush(Department department) {
        try {
            return departmentRepository.saveAndFlush(department);
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, CODE_CONSTRAINT)) {
                throw new UniquenessConflictException("department.duplicate_code",
                        "Department code already used in company " + department.getCompanyId() + ": " + department.getCode());
            }
            throw ex;
        }
    }

    private Department load(Long id) {
        return departmentRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException branchMismatch(Long branchId, Department parent) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "department.branch_mismatch",
                "Branch " + branchId + " differs from branch " + parent.getBranchId() + " of parent department " + parent.getId());
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "department.not_found", "department " + id + " not found");
    }
}
