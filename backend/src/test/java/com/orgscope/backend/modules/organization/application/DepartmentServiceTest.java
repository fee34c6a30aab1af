package com.orgscope.backend.modules.organization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
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
import com.orgscope.backend.modules.access.domain.AccessPredicate;
import com.orgscope.backend.modules.access.domain.CoordinateCondition;
import com.orgscope.backend.modules.access.domain.CoordinateField;
import com.orgscope.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.orgscope.backend.modules.hierarchy.application.HierarchyValidator;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyCycleException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.organization.domain.Branch;
import com.orgscope.backend.modules.organization.domain.Company;
import com.orgscope.backend.modules.organization.domain.Department;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BranchRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.DepartmentRepository;
import com.orgscope.backend.modules.organization.presentation.dto.CreateDepartmentRequest;
import com.orgscope.backend.modules.organization.presentation.dto.DepartmentResponse;
import com.orgscope.backend.modules.organization.presentation.dto.UpdateDepartmentRequest;
import com.orgscope.backend.support.InMemoryHierarchyLedger;
import com.orgscope.backend.support.TestEntities;

@ExtendWith(MockitoExtension.class)
class DepartmentServiceTest {

    private static final long BG = InMemoryHierarchyLedger.BUSINESS_GROUP_ID;
    private static final long COMPANY = InMemoryHierarchyLedger.COMPANY_ID;
    private static final long BRANCH = 100L;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private CompanyRepository companyRepository;

    @Mock
    private BranchRepository branchRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private AccessGuard accessGuard;

    private InMemoryHierarchyLedger ledger;
    private DepartmentService departmentService;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryHierarchyLedger(HierarchyKind.DEPARTMENT);
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        departmentService = new DepartmentService(
                departmentRepository,
                companyRepository,
                branchRepository,
                employeeRepository,
                new HierarchyValidator(List.of(ledger)),
                accessGuard,
                clock
        );
    }

    @Test
    @DisplayName("지점을 지정하지 않은 하위 부서는 상위 부서의 지점을 물려받는다")
    void childInheritsParentBranch() {
        ledger.put(1L, null);
        when(companyRepository.findByIdForUpdate(COMPANY)).thenReturn(Optional.of(company()));
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));
        when(departmentRepository.saveAndFlush(any(Department.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), 2L));

        DepartmentResponse response = departmentService.createDepartment(
                new CreateDepartmentRequest(COMPANY, null, 1L, " OPS ", "Operations", null));

        assertThat(response.branchId()).isEqualTo(BRANCH);
        assertThat(response.parentId()).isEqualTo(1L);
        assertThat(response.code()).isEqualTo("OPS");
        verify(accessGuard).require(AccessAction.CREATE, department(1L, null, BRANCH).coordinates());
    }

    @Test
    @DisplayName("상위 부서와 다른 지점을 지정하면 422로 거부된다")
    void rejectsBranchDifferentFromParent() {
        ledger.put(1L, null);
        when(companyRepository.findByIdForUpdate(COMPANY)).thenReturn(Optional.of(company()));
        when(branchRepository.findByIdForUpdate(200L)).thenReturn(Optional.of(branch(200L)));
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));

        assertThatThrownBy(() -> departmentService.createDepartment(
                new CreateDepartmentRequest(COMPANY, 200L, 1L, "OPS", "Operations", null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("department.branch_mismatch");
        verify(departmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("하위 부서 아래로 옮기면 순환으로 거부되고 상위는 바뀌지 않는다")
    void reparentingIntoOwnSubtreeFails() {
        ledger.put(1L, null).put(2L, 1L);
        Department root = department(1L, null, BRANCH);
        when(departmentRepository.findCompanyIdById(1L)).thenReturn(Optional.of(COMPANY));
        when(companyRepository.findByIdForUpdate(COMPANY)).thenReturn(Optional.of(company()));
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(root));

        assertThatThrownBy(() -> departmentService.updateDepartment(1L,
                new UpdateDepartmentRequest(null, null, 2L, null)))
                .isInstanceOf(HierarchyCycleException.class);
        assertThat(root.getParentId()).isNull();
        assertThat(ledger.lockOrder()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("상위 해제는 부서를 루트로 만든다")
    void detachMakesRoot() {
        ledger.put(1L, null).put(2L, 1L);
        Department child = department(2L, 1L, BRANCH);
        when(departmentRepository.findCompanyIdById(2L)).thenReturn(Optional.of(COMPANY));
        when(companyRepository.findByIdForUpdate(COMPANY)).thenReturn(Optional.of(company()));
        when(departmentRepository.findById(2L)).thenReturn(Optional.of(child));

        DepartmentResponse response = departmentService.updateDepartment(2L,
                new UpdateDepartmentRequest("Renamed", null, null, true));

        assertThat(response.parentId()).isNull();
        assertThat(response.name()).isEqualTo("Renamed");
    }

    @Test
    @DisplayName("상위 변경은 두 부서를 잠그기 전에 회사 행을 먼저 잠근다")
    void reparentLocksCompanyBeforeEdge() {
        ledger.put(1L, null).put(2L, null);
        List<Long> lockedBeforeCompany = new ArrayList<>();
        Department child = department(2L, null, BRANCH);
        when(departmentRepository.findCompanyIdById(2L)).thenReturn(Optional.of(COMPANY));
        when(companyRepository.findByIdForUpdate(COMPANY)).thenAnswer(invocation -> {
            lockedBeforeCompany.addAll(ledger.lockOrder());
            return Optional.of(company());
        });
        when(departmentRepository.findById(2L)).thenReturn(Optional.of(child));
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));

        departmentService.updateDepartment(2L, new UpdateDepartmentRequest(null, null, 1L, null));

        assertThat(lockedBeforeCompany).isEmpty();
        assertThat(ledger.lockOrder()).containsExactly(1L, 2L);
        assertThat(child.getParentId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("상위 변경이 없는 수정은 회사 행을 잠그지 않는다")
    void renameDoesNotLockCompany() {
        Department department = department(1L, null, BRANCH);
        when(departmentRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(department));
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(department));

        departmentService.updateDepartment(1L, new UpdateDepartmentRequest("Renamed", null, null, null));

        verify(companyRepository, never()).findByIdForUpdate(any());
        assertThat(department.getName()).isEqualTo("Renamed");
    }

    @Test
    @DisplayName("지점 소속 확인은 지점 행을 잠가 동시 비활성화와 직렬화된다")
    void branchIsLockedOnCreate() {
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company()));
        Branch inactive = branch(200L);
        inactive.deactivate(OffsetDateTime.parse("2024-12-01T00:00:00Z"));
        when(branchRepository.findByIdForUpdate(200L)).thenReturn(Optional.of(inactive));

        assertThatThrownBy(() -> departmentService.createDepartment(
                new CreateDepartmentRequest(COMPANY, 200L, null, "OPS", "Operations", null)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("branch.inactive");
        verify(branchRepository, never()).findById(any());
        verify(departmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("활성 직원이 남아 있는 부서는 비활성화할 수 없다")
    void deactivationBlockedByEmployees() {
        ledger.put(1L, null);
        when(departmentRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));
        when(employeeRepository.existsByDepartmentIdAndActiveTrue(1L)).thenReturn(true);

        assertThatThrownBy(() -> departmentService.deactivateDepartment(1L))
                .isInstanceOf(ActiveDescendantsException.class);
    }

    @Test
    @DisplayName("활성 하위 부서가 있으면 비활성화할 수 없다")
    void deactivationBlockedByChildren() {
        ledger.put(1L, null).put(2L, 1L);
        when(departmentRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));

        assertThatThrownBy(() -> departmentService.deactivateDepartment(1L))
                .isInstanceOf(ActiveDescendantsException.class);
    }

    @Test
    @DisplayName("같은 회사 안의 중복 코드는 409로 변환된다")
    void duplicateCodeIsConflict() {
        when(companyRepository.findById(COMPANY)).thenReturn(Optional.of(company()));
        when(departmentRepository.saveAndFlush(any(Department.class))).thenThrow(new DataIntegrityViolationException(
                "insert failed",
                new SQLException("duplicate key value violates unique constraint \"uq_department_company_code\"")));

        assertThatThrownBy(() -> departmentService.createDepartment(
                new CreateDepartmentRequest(COMPANY, null, null, "OPS", "Operations", null)))
                .isInstanceOf(UniquenessConflictException.class)
                .extracting("code").isEqualTo("department.duplicate_code");
    }

    @Test
    @DisplayName("하위 부서 목록은 호출자의 필터로 걸러진다")
    void descendantsAreFiltered() {
        ledger.put(1L, null).put(2L, 1L).put(3L, 1L);
        when(departmentRepository.findById(1L)).thenReturn(Optional.of(department(1L, null, BRANCH)));
        when(accessGuard.listFilter()).thenReturn(AccessPredicate.allOf(
                CoordinateCondition.in(CoordinateField.DEPARTMENT, List.of(1L, 2L))));
        when(departmentRepository.findByIdIn(anyList()))
                .thenReturn(List.of(department(3L, 1L, BRANCH), department(2L, 1L, BRANCH)));

        List<DepartmentResponse> descendants = departmentService.listDescendants(1L);

        assertThat(descendants).extracting(DepartmentResponse::id).containsExactly(2L);
    }

    @Test
    @DisplayName("계층 경로는 자기 자신부터 루트까지 반환한다")
    void hierarchyPathFromNodeToRoot() {
        ledger.put(1L, null).put(2L, 1L).put(3L, 2L);
        when(departmentRepository.findById(3L)).thenReturn(Optional.of(department(3L, 2L, BRANCH)));
        when(departmentRepository.findByIdIn(anyList())).thenReturn(List.of(
                department(1L, null, BRANCH), department(2L, 1L, BRANCH), department(3L, 2L, BRANCH)));

        assertThat(departmentService.hierarchyPath(3L))
                .extracting(DepartmentResponse::id)
                .containsExactly(3L, 2L, 1L);
    }

    private static Company company() {
        Company company = new Company();
        company.setBusinessGroupId(BG);
        company.setCode("ACME");
        company.setName("Acme");
        return TestEntities.withId(company, COMPANY);
    }

    private static Branch branch(long id) {
        Branch branch = new Branch();
        branch.setBusinessGroupId(BG);
        branch.setCompanyId(COMPANY);
        branch.setCode("BR" + id);
        branch.setName("Branch " + id);
        return TestEntities.withId(branch, id);
    }

    private static Department department(long id, Long parentId, Long branchId) {
        Department department = new Department();
        department.setBusinessGroupId(BG);
        department.setCompanyId(COMPANY);
        department.setBranchId(branchId);
        department.setParentId(parentId);
        department.setCode("D" + id);
        department.setName("Department " + id);
        return TestEntities.withId(department, id);
    }
}
