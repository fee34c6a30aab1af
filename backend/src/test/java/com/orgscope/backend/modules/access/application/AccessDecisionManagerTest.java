package com.orgscope.backend.modules.access.application;

import static com.orgscope.backend.support.OrgFixture.B1;
import static com.orgscope.backend.support.OrgFixture.C1;
import static com.orgscope.backend.support.OrgFixture.COMPANY_1;
import static com.orgscope.backend.support.OrgFixture.COMPANY_2;
import static com.orgscope.backend.support.OrgFixture.D1;
import static com.orgscope.backend.support.OrgFixture.DEPT_1;
import static com.orgscope.backend.support.OrgFixture.DEPT_2;
import static com.orgscope.backend.support.OrgFixture.DEPT_3;
import static com.orgscope.backend.support.OrgFixture.DEPT_4;
import static com.orgscope.backend.support.OrgFixture.DEPT_9;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.access.domain.PermissionGrant;
import com.orgscope.backend.modules.access.infrastructure.persistence.PermissionGrantRepository;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;
import com.orgscope.backend.support.OrgFixture;

class AccessDecisionManagerTest {

    private static final int ADMIN = 1;
    private static final int MANAGER = 2;
    private static final int SUPERVISOR = 3;
    private static final int COLLABORATOR = 4;
    private static final int GUEST = 5;

    private OrgFixture fixture;
    private PermissionGrantRepository permissionGrantRepository;

    @BeforeEach
    void setUp() {
        fixture = new OrgFixture();
        permissionGrantRepository = mock(PermissionGrantRepository.class);
    }

    private AccessDecisionManager manager(AccessPolicyProperties properties) {
        ScopeResolver scopeResolver = new ScopeResolver(properties, fixture.orgPathResolver());
        return new AccessDecisionManager(
                new PermissionOverride(permissionGrantRepository, properties),
                scopeResolver,
                new RoleDefaultVoter(properties));
    }

    private AccessDecisionManager manager() {
        return manager(AccessPolicyProperties.defaults());
    }

    private static AccessPrincipal principal(long userId, int level, OrgNodeRef... scopes) {
        return new AccessPrincipal(userId, level, List.of(scopes));
    }

    @Test
    @DisplayName("회사 범위를 가진 매니저는 소속 부서를 수정할 수 있지만 다른 회사는 거부된다")
    void companyScopeCoversItsSubtreeOnly() {
        AccessPrincipal manager = principal(7L, MANAGER, OrgNodeRef.company(C1));

        assertThat(manager().authorize(manager, AccessAction.UPDATE, DEPT_2)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(manager, AccessAction.READ, COMPANY_1)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(manager, AccessAction.UPDATE, COMPANY_2)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(manager, AccessAction.READ, DEPT_4)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("범위 안이라도 역할에 없는 동작은 거부된다")
    void roleActionsStillApplyInsideScope() {
        AccessPrincipal manager = principal(7L, MANAGER, OrgNodeRef.company(C1));

        assertThat(manager().authorize(manager, AccessAction.DELETE, DEPT_1)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("D1 범위는 D1과 하위 D2를 포함하고 형제 D3와 다른 회사의 D4는 포함하지 않는다")
    void departmentScopeCoversDescendants() {
        AccessPrincipal supervisor = principal(8L, SUPERVISOR, OrgNodeRef.department(D1));

        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_1)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(supervisor, AccessAction.UPDATE, DEPT_2)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_3)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_4)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(supervisor, AccessAction.UPDATE, DEPT_4)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(supervisor, AccessAction.READ, COMPANY_1)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("여러 범위를 가진 사용자는 합집합에 접근한다")
    void multipleScopesAreUnioned() {
        AccessPrincipal supervisor = principal(8L, SUPERVISOR, OrgNodeRef.department(D1),
                OrgNodeRef.department(OrgFixture.D3));

        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_2)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_3)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_9)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("범위가 없는 관리자는 모든 노드에 모든 동작이 허용된다")
    void unscopedAdminIsUnrestricted() {
        AccessPrincipal admin = AccessPrincipal.unscoped(1L, ADMIN);

        for (var target : OrgFixture.ALL) {
            assertThat(manager().authorize(admin, AccessAction.DELETE, target)).isEqualTo(AccessVerdict.ALLOW);
        }
    }

    @Test
    @DisplayName("범위가 지정된 관리자는 그 범위로 제한된다")
    void scopedAdminIsLimitedToScope() {
        AccessPrincipal admin = principal(1L, ADMIN, OrgNodeRef.company(C1));

        assertThat(manager().authorize(admin, AccessAction.DELETE, DEPT_1)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(admin, AccessAction.READ, COMPANY_2)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("역할이 허용하지 않는 범위 유형은 무시된다")
    void ineffectiveScopeTypeIsIgnored() {
        // supervisors may only hold department scopes
        AccessPrincipal supervisor = principal(8L, SUPERVISOR, OrgNodeRef.company(C1));

        assertThat(manager().authorize(supervisor, AccessAction.READ, DEPT_1)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("자기 자신 전용 역할은 본인과 연결된 자원만 읽을 수 있다")
    void selfOnlyRoleReadsOwnResources() {
        AccessPrincipal collaborator = AccessPrincipal.unscoped(42L, COLLABORATOR);

        assertThat(manager().authorize(collaborator, AccessAction.READ, DEPT_1.withOwner(42L)))
                .isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(collaborator, AccessAction.READ, DEPT_1.withOwner(43L)))
                .isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(collaborator, AccessAction.UPDATE, DEPT_1.withOwner(42L)))
                .isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("지점 범위는 기본적으로 회사 직속 부서를 포함하지 않는다")
    void branchScopeExcludesCorporateDepartmentsByDefault() {
        AccessPrincipal manager = principal(7L, MANAGER, OrgNodeRef.branch(B1));

        assertThat(manager().authorize(manager, AccessAction.READ, DEPT_1)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager().authorize(manager, AccessAction.READ, DEPT_9)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("설정을 켜면 지점 범위가 같은 회사의 직속 부서까지 포함한다")
    void branchScopeIncludesCorporateDepartmentsWhenEnabled() {
        AccessPolicyProperties properties = AccessPolicyProperties.defaults()
                .withBranchScopeIncludesCorporateDepartments(true);
        AccessPrincipal manager = principal(7L, MANAGER, OrgNodeRef.branch(B1));

        assertThat(manager(properties).authorize(manager, AccessAction.READ, DEPT_9)).isEqualTo(AccessVerdict.ALLOW);
        assertThat(manager(properties).authorize(manager, AccessAction.READ, COMPANY_1)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager(properties).authorize(manager, AccessAction.READ, DEPT_4)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("명시적 거부는 범위 허용보다 우선한다")
    void explicitDenyBeatsScope() {
        AccessPrincipal manager = principal(7L, MANAGER, OrgNodeRef.company(C1));
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                7L, "/api/v1/departments/1001", "PATCH"))
                .thenReturn(Optional.of(new PermissionGrant(7L, "/api/v1/departments/1001", "PATCH", false)));

        AccessRequest request = new AccessRequest(manager, AccessAction.UPDATE, DEPT_2,
                "/api/v1/departments/1001", "PATCH");

        assertThat(manager().decide(request)).isEqualTo(AccessVerdict.DENY);
        assertThatThrownBy(() -> manager().check(request)).isInstanceOf(AuthorizationDeniedException.class);
    }

    @Test
    @DisplayName("명시적 허용은 역할 거부보다 우선한다")
    void explicitAllowBeatsRole() {
        AccessPrincipal guest = AccessPrincipal.unscoped(9L, GUEST);
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                9L, "/api/v1/employees", "GET"))
                .thenReturn(Optional.of(new PermissionGrant(9L, "/api/v1/employees", "GET", true)));

        AccessRequest request = new AccessRequest(guest, AccessAction.READ, DEPT_4,
                "/api/v1/employees/7/subordinates/", "get");

        assertThat(manager().decide(request)).isEqualTo(AccessVerdict.ALLOW);
        assertThatCode(() -> manager().check(request)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("엔드포인트가 없는 판단에는 권한 재정의가 적용되지 않는다")
    void overrideNeedsEndpoint() {
        AccessPrincipal guest = AccessPrincipal.unscoped(9L, GUEST);

        assertThat(manager().authorize(guest, AccessAction.READ, DEPT_1)).isEqualTo(AccessVerdict.DENY);
    }

    @Test
    @DisplayName("어떤 규칙에도 해당하지 않으면 거부된다")
    void defaultsToDeny() {
        AccessPrincipal unknownRole = AccessPrincipal.unscoped(11L, 9);
        AccessPrincipal unscopedManager = AccessPrincipal.unscoped(12L, MANAGER);

        assertThat(manager().authorize(unknownRole, AccessAction.READ, COMPANY_1)).isEqualTo(AccessVerdict.DENY);
        assertThat(manager().authorize(unscopedManager, AccessAction.READ, COMPANY_1)).isEqualTo(AccessVerdict.DENY);
    }
}
