package com.orgscope.backend.modules.organization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.error.UniquenessConflictException;
import com.orgscope.backend.modules.access.application.AccessGuard;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.presentation.dto.BranchResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateBranchRequest;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateBranchRequest;
import com.orgscope.backend.support.TestEntities;

@ExtendWith(MockitoExtension.class)
class BranchServiceTest {

    private static final long BG = 1L;
    private static final long COMPANY = 10L;

    @Mock
    private BranchRepository branchRepository;

    @Mock
    private CompanyRepository companyRepository;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private AccessGuard accessGuard;

    private BranchService branchService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        branchService = new BranchService(branchRepository, companyRepository, departmentRepository,
                employeeRepository, accessGuard, clock);
    }

    @Test
    @DisplayName("지점은 회사의 기업그룹을 물려받고 회사 좌표로 CREATE 권한을 확인한다")
    void createInheritsBusinessGroup() {
        Company company = company();
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company));
        when(branchRepository.saveAndFlush(any(Branch.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), 100L));

        BranchResponse response = branchService.createBranch(
                new CreateBranchRequest(COMPANY, " SEOUL ", "Seoul", true));

        assertThat(response.id()).isEqualTo(100L);
        assertThat(response.businessGroupId()).isEqualTo(BG);
        assertThat(response.code()).isEqualTo("SEOUL");
        assertThat(response.headquarters()).isTrue();
        verify(accessGuard).require(AccessAction.CREATE, company.coordinates());
    }

    @Test
    @DisplayName("회사에 활성 본사가 이미 있으면 409 branch.duplicate_headquarters")
    void secondHeadquartersIsConflict() {
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company()));
        when(branchRepository.saveAndFlush(any(Branch.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uq_branch_headquarters\"")));

        assertThatThrownBy(() -> branchService.createBranch(new CreateBranchRequest(COMPANY, "BUSAN", "Busan", true)))
                .isInstanceOf(UniquenessConflictException.class)
                .extracting("code").isEqualTo("branch.duplicate_headquarters");
    }

    @Test
    @DisplayName("지점 코드가 회사 안에서 중복되면 409 branch.duplicate_code")
    void duplicateCodeIsConflict() {
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company()));
        when(branchRepository.saveAndFlush(any(Branch.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uq_branch_company_code\"")));

        assertThatThrownBy(() -> branchService.createBranch(new CreateBranchRequest(COMPANY, "SEOUL", "Seoul", false)))
                .isInstanceOf(UniquenessConflictException.class)
                .extracting("code").isEqualTo("branch.duplicate_code");
    }

    @Test
    @DisplayName("비활성 회사에는 지점을 만들 수 없다")
    void inactiveCompanyIsRejected() {
        Company company = company();
        company.deactivate(OffsetDateTime.parse("2024-12-01T00:00:00Z"));
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company));

        assertThatThrownBy(() -> branchService.createBranch(new CreateBranchRequest(COMPANY, "SEOUL", "Seoul", false)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("company.inactive");
        verify(branchRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("활성 부서가 남아 있는 지점은 비활성화할 수 없다")
    void deactivationBlockedByDepartments() {
        when(branchRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(branch(100L, true)));
        when(departmentRepository.existsByBranchIdAndActiveTrue(100L)).thenReturn(true);

        assertThatThrownBy(() -> branchService.deactivateBranch(100L))
                .isInstanceOf(ActiveDescendantsException.class);
    }

    @Test
    @DisplayName("비활성화하면 본사 표시도 해제된다")
    void deactivationClearsHeadquarters() {
        when(branchRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(branch(100L, true)));
        when(departmentRepository.existsByBranchIdAndActiveTrue(100L)).thenReturn(false);
        when(employeeRepository.existsByBranchIdAndActiveTrue(100L)).thenReturn(false);

        BranchResponse response = branchService.deactivateBranch(100L);

        assertThat(response.active()).isFalse();
        assertThat(response.headquarters()).isFalse();
        assertThat(response.deactivatedAt()).isEqualTo(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        verify(accessGuard).require(AccessAction.DELETE, branch(100L, false).coordinates());
    }

    @Test
    @DisplayName("비활성 지점을 본사로 지정하면 422")
    void inactiveBranchCannotBecomeHeadquarters() {
        Branch branch = branch(100L, false);
        branch.deactivate(OffsetDateTime.parse("2024-12-01T00:00:00Z"));
        when(branchRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(branch));

        assertThatThrownBy(() -> branchService.updateBranch(100L, new UpdateBranchRequest(null, true)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("branch.inactive");
        verify(branchRepository, never()).saveAndFlush(any());
    }

    private static Company company() {
        Company company = new Company();
        company.setBusinessGroupId(BG);
        company.setCode("ACME");
        company.setName("Acme");
        return TestEntities.withId(company, COMPANY);
    }

    private static Branch branch(long id, boolean headquarters) {
        Branch branch = new Branch();
        branch.setBusinessGroupId(BG);
        branch.setCompanyId(COMPANY);
        branch.setCode("BR" + id);
        branch.setName("Branch " + id);
        branch.setHeadquarters(headquarters);
        return TestEntities.withId(branch, id);
    }
}
