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
import com.orgscope.backend.modules.organization.domain.BusinessGroup;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BusinessGroupRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.OrgSpecifications;
import com.orgscope.backend.modules.organization.presentation.dto.CompanyResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateCompanyRequest;
import com.orgscope.backend.modules.organization.presentation.dto.RenameOrgUnitRequest;

@Service
@Transactional
public class CompanyService {

    private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

    static final String CODE_CONSTRAINT = "uq_company_business_group_code";

    private final CompanyRepository companyRepository;
    private final BusinessGroupRepository businessGroupRepository;
    private final BranchRepository branchRepository;
    private final DepartmentRepository departmentRepository;
    private final EmployeeRepository employeeRepository;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public CompanyService(
            CompanyRepository companyRepository,
            BusinessGroupRepository businessGroupRepository,
            BranchRepository branchRepository,
            DepartmentRepository departmentRepository,
            EmployeeRepository employeeRepository,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.companyRepository = companyRepository;
        this.businessGroupRepository = businessGroupRepository;
        this.branchRepository = branchRepository;
        this.departmentRepository = departmentRepository;
        this.employeeRepository = employeeRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public CompanyResponse createCompany(CreateCompanyRequest request) {
        BusinessGroup group = businessGroupRepository.findById(request.businessGroupId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "business_group.not_found"));
        if (!group.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "business_group.inactive");
        }
        accessGuard.require(AccessAction.CREATE, group.coordinates());

        Company company = new Company();
        company.setBusinessGroupId(group.getId());
        company.setCode(request.code().trim());
        company.setName(request.name().trim());
        try {
            company = companyRepository.saveAndFlush(company);
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, CODE_CONSTRAINT)) {
                throw new UniquenessConflictException("company.duplicate_code",
                        "Company code already used in business group " + group.getId() + ": " + company.getCode());
            }
            throw ex;
        }
        log.info("Company {} ({}) created in business group {}", company.getId(), company.getCode(), group.getId());
        return CompanyResponse.from(company);
    }

    @Transactional(readOnly = true)
    public CompanyResponse getCompany(Long id) {
        Company company = load(id);
        accessGuard.require(AccessAction.READ, company.coordinates());
        return CompanyResponse.from(company);
    }

    @Transactional(readOnly = true)
    public PageResponse<CompanyResponse> listCompanies(Long businessGroupId, String keyword, boolean includeInactive,
            Pageable pageable) {
        Specification<Company> search = Specification
                .where(OrgSpecifications.<Company>attributeEquals("businessGroupId", businessGroupId))
                .and(OrgSpecifications.keyword(keyword))
                .and(OrgSpecifications.activeOnly(includeInactive));
        Specification<Company> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                OrgSpecifications.COMPANY_MAPPING, search);
        return PageResponse.from(companyRepository.findAll(spec, pageable), CompanyResponse::from);
    }

    public CompanyResponse renameCompany(Long id, RenameOrgUnitRequest request) {
        Company company = load(id);
        accessGuard.require(AccessAction.UPDATE, company.coordinates());
        company.setName(request.name().trim());
        return CompanyResponse.from(company);
    }

    public CompanyResponse deactivateCompany(Long id) {
        Company company = companyRepository.findByIdForUpdate(id).orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, company.coordinates());
        if (!company.isActive()) {
            return CompanyResponse.from(company);
        }
        if (branchRepository.existsByCompanyIdAndActiveTrue(id)
                || departmentRepository.existsByCompanyIdAndActiveTrue(id)
                || employeeRepository.existsByCompanyIdAndActiveTrue(id)) {
            throw new ActiveDescendantsException("company " + id + " still has active branches, departments or employees");
        }
        company.deactivate(OffsetDateTime.now(clock));
        log.info("Company {} deactivated", id);
        return CompanyResponse.from(company);
    }

    private Company load(Long id) {
        return companyRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "company.not_found", "company " + id + " not found");
    }
}
