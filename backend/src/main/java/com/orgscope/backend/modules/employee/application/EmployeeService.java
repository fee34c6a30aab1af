package com.orgscope.backend.modules.employee.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
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
import com.orgscope.backend.modules.employee.domain.Employee;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeSpecifications;
import com.orgscope.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.orgscope.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.orgscope.backend.modules.employee.presentation.dto.TeamTreeResponse;
import com.orgscope.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;
import com.orgscope.backend.modules.hierarchy.application.HierarchyValidator;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.TenantMismatchException;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.domain.Department;
import com.orgscope.backend.modules.organization.domain.Position;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.PositionRepository;

/**
 * Employee lifecycle and supervisor-chain reads.
 *
 * <p>Supervisor changes lock the owning company row first, then the employee and the new supervisor,
 * so that concurrent edits inside one company cannot combine into a cycle. Writes that place an
 * employee lock the target branch, department and position rows after that, which makes their
 * deactivation and this placement mutually exclusive. Subordinates are ordered by the hierarchy
 * weight of their position, employees without a position last.</p>
 */
@Service
@Transactional
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    static final String CODE_CONSTRAINT = "uq_employee_company_code";
    static final String USER_CONSTRAINT = "uq_employee_user_active";

    // sorts after every catalog weight (0..100)
    private static final int UNPOSITIONED_WEIGHT = 101;

    private final EmployeeRepository employeeRepository;
    private final CompanyRepository companyRepository;
    private final BranchRepository branchRepository;
    private final DepartmentRepository departmentRepository;
    private final PositionRepository positionRepository;
    private final HierarchyValidator hierarchyValidator;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public EmployeeService(
            EmployeeRepository employeeRepository,
            CompanyRepository companyRepository,
            BranchRepository branchRepository,
            DepartmentRepository departmentRepository,
            PositionRepository positionRepository,
            HierarchyValidator hierarchyValidator,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.employeeRepository = employeeRepository;
        this.companyRepository = companyRepository;
        this.branchRepository = branchRepository;
        this.departmentRepository = departmentRepository;
        this.positionRepository = positionRepository;
        this.hierarchyValidator = hierarchyValidator;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public EmployeeResponse createEmployee(CreateEmployeeRequest request) {
        Company company = (request.supervisorId() != null
                ? companyRepository.findByIdForUpdate(request.companyId())
                : companyRepository.findById(request.companyId()))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
        if (!company.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "company.inactive");
        }
        if (request.supervisorId() != null) {
            hierarchyValidator.lockEdge(HierarchyKind.EMPLOYEE, null, request.supervisorId());
            requireAssignableSupervisor(request.supervisorId());
            hierarchyValidator.validateEdge(HierarchyKind.EMPLOYEE,
                    HierarchyNode.unsaved(company.getId(), company.getBusinessGroupId()), request.supervisorId());
        }

        Long branchId = request.branchId();
        if (branchId != null) {
            requireBranchOfCompany(branchId, company.getId());
        }
        if (request.departmentId() != null) {
            Department department = requireDepartmentOfCompany(request.departmentId(), company.getId());
            branchId = reconcileBranch(branchId, department);
        }
        if (request.positionId() != null) {
            requirePositionOfCompany(request.positionId(), company.getId());
        }

        Employee employee = new Employee();
        employee.setBusinessGroupId(company.getBusinessGroupId());
        employee.setCompanyId(company.getId());
        employee.setBranchId(branchId);
        employee.setDepartmentId(request.departmentId());
        employee.setSupervisorId(request.supervisorId());
        employee.setPositionId(request.positionId());
        employee.setUserId(request.userId());
        employee.setEmployeeCode(request.employeeCode().trim());
        employee.setFullName(request.fullName().trim());
        employee.setEmail(request.email());
        employee.setJobTitle(request.jobTitle());
        accessGuard.require(AccessAction.CREATE, employee.coordinates());

        employee = saveAndFlush(employee);
        log.info("Employee {} ({}) created in company {}", employee.getId(), employee.getEmployeeCode(), company.getId());
        return EmployeeResponse.from(employee);
    }

    public EmployeeResponse updateEmployee(Long id, UpdateEmployeeRequest request) {
        Long newSupervisorId = request.clearSupervisor() ? null : request.supervisorId();
        boolean reassign = request.clearSupervisor() || request.supervisorId() != null;

        if (reassign) {
            Long companyId = employeeRepository.findCompanyIdById(id).orElseThrow(() -> notFound(id));
            companyRepository.findByIdForUpdate(companyId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
            hierarchyValidator.lockEdge(HierarchyKind.EMPLOYEE, id, newSupervisorId);
        } else {
            employeeRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        }
        Employee employee = load(id);
        accessGuard.require(AccessAction.UPDATE, employee.coordinates());

        if (reassign && !Objects.equals(employee.getSupervisorId(), newSupervisorId)) {
            if (newSupervisorId != null) {
                requireAssignableSupervisor(newSupervisorId);
            }
            hierarchyValidator.validateEdge(HierarchyKind.EMPLOYEE, id, newSupervisorId);
            log.info("Employee {} supervisor changed from {} to {}", id, employee.getSupervisorId(), newSupervisorId);
            employee.setSupervisorId(newSupervisorId);
        }
        if (request.departmentId() != null && !request.departmentId().equals(employee.getDepartmentId())) {
            Department department = requireDepartmentOfCompany(request.departmentId(), employee.getCompanyId());
            employee.setDepartmentId(department.getId());
            if (department.getBranchId() != null) {
                employee.setBranchId(department.getBranchId());
            }
            accessGuard.require(AccessAction.UPDATE, employee.coordinates());
        }
        if (request.positionId() != null && !request.positionId().equals(employee.getPositionId())) {
            requirePositionOfCompany(request.positionId(), employee.getCompanyId());
            employee.setPositionId(request.positionId());
        }
        if (request.fullName() != null) {
            employee.setFullName(request.fullName().trim());
        }
        if (request.email() != null) {
            employee.setEmail(request.email());
        }
        if (request.jobTitle() != null) {
            employee.setJobTitle(request.jobTitle());
        }
        return EmployeeResponse.from(employee);
    }

    public EmployeeResponse deactivateEmployee(Long id) {
        Employee employee = employeeRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, employee.coordinates());
        if (!employee.isActive()) {
            return EmployeeResponse.from(employee);
        }
        hierarchyValidator.validateDeactivation(HierarchyKind.EMPLOYEE, id);
        employee.deactivate(OffsetDateTime.now(clock));
        log.info("Employee {} deactivated", id);
        return EmployeeResponse.from(employee);
    }

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployee(Long id) {
        Employee employee = load(id);
        accessGuard.require(AccessAction.READ, employee.coordinates());
        return EmployeeResponse.from(employee);
    }

    @Transactional(readOnly = true)
    public PageResponse<EmployeeResponse> listEmployees(Long companyId, Long departmentId, String keyword,
            boolean includeInactive, Pageable pageable) {
        Specification<Employee> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                EmployeeSpecifications.ACCESS_MAPPING,
                EmployeeSpecifications.search(companyId, departmentId, keyword, includeInactive));
        return PageResponse.from(employeeRepository.findAll(spec, pageable), EmployeeResponse::from);
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> listSubordinates(Long id) {
        Employee employee = load(id);
        accessGuard.require(AccessAction.READ, employee.coordinates());
        AccessPredicate visible = accessGuard.listFilter();
        List<Employee> subordinates = employeeRepository.findBySupervisorId(id).stream()
                .filter(subordinate -> visible.test(subordinate.coordinates()))
                .toList();
        return subordinates.stream()
                .sorted(hierarchyOrder(subordinates))
                .map(EmployeeResponse::from)
                .toList();
    }

    /**
     * The employee and every subordinate below it. A subordinate the caller may not read is left
     * out together with its own team. Siblings are ordered like {@link #listSubordinates(Long)}.
     */
    @Transactional(readOnly = true)
    public TeamTreeResponse teamTree(Long id) {
        Employee root = load(id);
        accessGuard.require(AccessAction.READ, root.coordinates());
        AccessPredicate visible = accessGuard.listFilter();

        List<Long> ids = new ArrayList<>();
        hierarchyValidator.descendants(HierarchyKind.EMPLOYEE, id).forEach(ids::add);
        List<Employee> members = loadInOrder(ids).stream()
                .filter(member -> visible.test(member.coordinates()))
                .toList();
        Map<Long, List<Employee>> bySupervisor = new LinkedHashMap<>();
        for (Employee member : members) {
            bySupervisor.computeIfAbsent(member.getSupervisorId(), key -> new ArrayList<>()).add(member);
        }
        Comparator<Employee> order = hierarchyOrder(members);
        bySupervisor.values().forEach(team -> team.sort(order));
        return buildTree(root, bySupervisor);
    }

    /**
     * Supervisors of the employee, from the direct supervisor to the top.
     */
    @Transactional(readOnly = true)
    public List<EmployeeResponse> supervisorChain(Long id) {
        Employee employee = load(id);
        accessGuard.require(AccessAction.READ, employee.coordinates());
        AccessPredicate visible = accessGuard.listFilter();
        List<Long> ids = hierarchyValidator.ancestorPath(HierarchyKind.EMPLOYEE, id).stream()
                .skip(1)
                .map(HierarchyNode::id)
                .toList();
        return loadInOrder(ids).stream()
                .filter(supervisor -> visible.test(supervisor.coordinates()))
                .map(EmployeeResponse::from)
                .toList();
    }

    private TeamTreeResponse buildTree(Employee node, Map<Long, List<Employee>> bySupervisor) {
        List<TeamTreeResponse> children = bySupervisor.getOrDefault(node.getId(), List.of()).stream()
                .map(child -> buildTree(child, bySupervisor))
                .toList();
        return new TeamTreeResponse(EmployeeResponse.from(node), children);
    }

    private List<Employee> loadInOrder(List<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<Long, Employee> byId = employeeRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    private Comparator<Employee> hierarchyOrder(Collection<Employee> employees) {
        Set<Long> positionIds = employees.stream()
                .map(Employee::getPositionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<Long, Integer> weights = positionIds.isEmpty() ? Map.of() : positionRepository.findByIdIn(positionIds).stream()
                .collect(Collectors.toMap(Position::getId, Position::getHierarchyWeight));
        return Comparator.<Employee>comparingInt(employee -> weights.getOrDefault(employee.getPositionId(), UNPOSITIONED_WEIGHT))
                .thenComparing(Employee::getFullName, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Employee::getId);
    }

    private Long reconcileBranch(Long branchId, Department department) {
        if (department.getBranchId() == null) {
            return branchId;
        }
        if (branchId != null && !branchId.equals(department.getBranchId())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "employee.branch_mismatch",
                    "Department " + department.getId() + " belongs to branch " + department.getBranchId());
        }
        return department.getBranchId();
    }

    private void requireBranchOfCompany(Long branchId, Long companyId) {
        Branch branch = branchRepository.findByIdForUpdate(branchId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "branch.not_found"));
        if (!branch.getCompanyId().equals(companyId)) {
            throw new TenantMismatchException("branch " + branchId + " does not belong to company " + companyId);
        }
        if (!branch.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "branch.inactive");
        }
    }

    private Department requireDepartmentOfCompany(Long departmentId, Long companyId) {
        Department department = departmentRepository.findByIdForUpdate(departmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "department.not_found"));
        if (!department.getCompanyId().equals(companyId)) {
            throw new TenantMismatchException("department " + departmentId + " does not belong to company " + companyId);
        }
        if (!department.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "department.inactive");
        }
        return department;
    }

    private void requirePositionOfCompany(Long positionId, Long companyId) {
        Position position = positionRepository.findByIdForUpdate(positionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "position.not_found"));
        if (!position.getCompanyId().equals(companyId)) {
            throw new TenantMismatchException("position " + positionId + " does not belong to company " + companyId);
        }
        if (!position.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "position.inactive");
        }
    }

    /**
     * Gaining a subordinate changes the supervisor's team, so the caller needs UPDATE on the supervisor.
     */
    private void requireAssignableSupervisor(Long supervisorId) {
        Employee supervisor = load(supervisorId);
        accessGuard.require(AccessAction.UPDATE, supervisor.coordinates());
        if (!supervisor.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "employee.supervisor_inactive");
        }
    }

    private Employee saveAndFlush(Employee employee) {
        try {
            return employeeRepository.saveAndFlush(employee);
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, CODE_CONSTRAINT)) {
                throw new UniquenessConflictException("employee.duplicate_code",
                        "Employee code already used in company " + employee.getCompanyId() + ": " + employee.getEmployeeCode());
            }
            if (ConstraintViolations.isViolationOf(ex, USER_CONSTRAINT)) {
                throw new UniquenessConflictException("employee.duplicate_user",
                        "User " + employee.getUserId() + " is already linked to an active employee");
            }
            throw ex;
        }
    }

    private Employee load(Long id) {
        return employeeRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "employee.not_found", "employee " + id + " not found");
    }
}
