package com.orgscope.backend.modules.organization.application;

import java.time.Clock;
import java.time.OffsetDateTime;

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
import com.orgscope.backend.modules.access.infrastructure.persistence.AccessSpecifications;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.OrgSpecifications;
import com.orgscope.backend.modules.organization.presentation.dto.BranchResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateBranchRequest;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateBranchRequest;

/**
 * Branch lifecycle. The single active headquarters per company is guarded by the partial unique
 * index {@value #HEADQUARTERS_CONSTRAINT}; a violation surfaces as a 409 and rolls the write back.
 */
@Service
@Transactional
public class BranchService {

    private static final Logger log = LoggerFactory.getLogger(BranchService.class);

    static final String CODE_CONSTRAINT = "uq_branch_company_code";
    static final String HEADQUARTERS_CONSTRAINT = "uq_branch_headquarters";

    private final BranchRepository branchRepository;
    private final CompanyRepository companyRepository;
    private final DepartmentRepository departmentRepository;
    private final EmployeeRepository employeeRepository;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public BranchService(
            BranchRepository branchRepository,
            CompanyRepository companyRepository,
            DepartmentRepository departmentRepository,
            EmployeeRepository employeeRepository,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.branchRepository = branchRepository;
        this.companyRepository = companyRepository;
        this.departmentRepository = departmentRepository;
        this.employeeRepository = employeeRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public BranchResponse createBranch(CreateBranchRequest request) {
        Company company = companyRepository.findById(request.companyId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "company.not_found"));
        if (!company.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "company.inactive");
        }
        accessGuard.require(AccessAction.CREATE, company.coordinates());

        Branch branch = new Branch();
        branch.setBusinessGroupId(company.getBusinessGroupId());
        branch.setCompanyId(company.getId());
        branch.setCode(request.code().trim());
        branch.setName(request.name().trim());
        branch.setHeadquarters(request.headquarters());
        branch = saveAndFlush(branch);
        log.info("Branch {} ({}) created in company {}, headquarters={}", branch.getId(), branch.getCode(),
                company.getId(), branch.isHeadquarters());
        return BranchResponse.from(branch);
    }

    @Transactional(readOnly = true)
    public BranchResponse getBranch(Long id) {
        Branch branch = load(id);
        accessGuard.require(AccessAction.READ, branch.coordinates());
        return BranchResponse.from(branch);
    }

    @Transactional(readOnly = true)
    public PageResponse<BranchResponse> listBranches(Long companyId, String keyword, boolean includeInactive,
            Pageable pageable) {
        Specification<Branch> search = Specification
                .where(OrgSpecifications.<Branch>attributeEquals("companyId", companyId))
                .and(OrgSpecifications.keyword(keyword))
                .and(OrgSpecifications.activeOnly(includeInactive));
        Specification<Branch> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                OrgSpecifications.BRANCH_MAPPING, search);
        return PageResponse.from(branchRepository.findAll(spec, pageable), BranchResponse::from);
    }

    public BranchResponse updateBranch(Long id, UpdateBranchRequest request) {
        Branch branch = branchRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.UPDATE, branch.coordinates());
        if (request.name() != null) {
            branch.setName(request.name().trim());
        }
        if (request.headquarters() != null) {
            if (request.headquarters() && !branch.isActive()) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "branch.inactive",
                        "An inactive branch cannot become headquarters");
            }
            branch.setHeadquarters(request.headquarters());
        }
        return BranchResponse.from(saveAndFlush(branch));
    }

    public BranchResponse deactivateBranch(Long id) {
        Branch branch = branchRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, branch.coordinates());
        if (!branch.isActive()) {
            return BranchResponse.from(branch);
        }
        if (departmentRepository.existsByBranchIdAndActiveTrue(id) || employeeRepository.existsByBranchIdAndActiveTrue(id)) {
            throw new ActiveDescendantsException("branch " + id + " still has active departments or employees");
        }
        branch.deactivate(OffsetDateTime.now(clock));
        log.info("Branch {} deactivated", id);
        return BranchResponse.from(branch);
    }

    private Branch saveAndFlush(Branch branch) {
        try {
            return branchRepository.saveAndFlush(branch);
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, HEADQUARTERS_CONSTRAINT)) {
                throw new UniquenessConflictException("branch.duplicate_headquarters",
                        "Company " + branch.getCompanyId() + " already has an active headquarters branch");
            }
            if (ConstraintViolations.isViolationOf(ex, CODE_CONSTRAINT)) {
                throw new UniquenessConflictException("branch.duplicate_code",
                        "Branch code already used in company " + branch.getCompanyId() + ": " + branch.getCode());
            }
            throw ex;
        }
    }

    private Branch load(Long id) {
        return branchRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "branch.not_found", "branch " + id + " not found");
    }
}
