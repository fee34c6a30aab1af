package com.orgscope.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.error.UniquenessConflictException;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.domain.AccessPrincipal;
import com.orgscope.backend.modules.access.domain.AuthorizationDeniedException;
import com.orgscope.backend.modules.access.domain.UserAccount;
import com.orgscope.backend.modules.access.domain.UserScope;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserAccountRepository;
import com.orgscope.backend.modules.access.infrastructure.persistence.UserScopeRepository;
import com.orgscope.backend.modules.access.presentation.dto.AssignScopeRequest;
import com.orgscope.backend.modules.access.presentation.dto.UserScopeResponse;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.domain.OrgNodeRef;
import com.orgscope.backend.modules.organization.domain.OrgUnitType;
import com.orgscope.backend.support.TestEntities;

@ExtendWith(MockitoExtension.class)
class UserScopeServiceTest {

    private static final long TARGET_USER = 30L;
    private static final AccessPrincipal MANAGER = AccessPrincipal.unscoped(2L, 2);

    @Mock
    private UserScopeRepository userScopeRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private OrgPathResolver orgPathResolver;

    @Mock
    private AccessGuard accessGuard;

    private UserScopeService userScopeService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        userScopeService = new UserScopeService(userScopeRepository, userAccountRepository, orgPathResolver,
                accessGuard, AccessPolicyProperties.defaults(), clock);
    }

    @Test
    @DisplayName("범위를 부여하려면 부여자가 해당 노드에 생성 권한을 가져야 한다")
    void assignRequiresCreateOnNode() {
        OrgCoordinates company = OrgCoordinates.ofCompany(1L, 10L);
        when(accessGuard.requireRoleLevelAtMost(2)).thenReturn(MANAGER);
        when(userAccountRepository.findByIdForUpdate(TARGET_USER)).thenReturn(Optional.of(user(2)));
        when(orgPathResolver.coordinatesOf(OrgNodeRef.company(10L))).thenReturn(company);
        when(userScopeRepository.saveAndFlush(any(UserScope.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), 5L));

        UserScopeResponse response = userScopeService.assignScope(TARGET_USER,
                new AssignScopeRequest(OrgUnitType.COMPANY, 10L));

        assertThat(response.id()).isEqualTo(5L);
        assertThat(response.scopeType()).isEqualTo(OrgUnitType.COMPANY);
        assertThat(response.active()).isTrue();
        verify(accessGuard).require(AccessAction.CREATE, company);
    }

    @Test
    @DisplayName("대상 사용자의 역할이 허용하지 않는 범위 유형은 422로 거부된다")
    void scopeTypeMustFitRole() {
        when(accessGuard.requireRoleLevelAtMost(2)).thenReturn(MANAGER);
        when(userAccountRepository.findByIdForUpdate(TARGET_USER)).thenReturn(Optional.of(user(3)));

        assertThatThrownBy(() -> userScopeService.assignScope(TARGET_USER,
                new AssignScopeRequest(OrgUnitType.COMPANY, 10L)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("scope.type_not_permitted");
        verifyNoInteractions(orgPathResolver);
    }

    @Test
    @DisplayName("이미 활성 상태인 같은 범위는 409로 거부된다")
    void duplicateAssignmentIsConflict() {
        when(accessGuard.requireRoleLevelAtMost(2)).thenReturn(MANAGER);
        when(userAccountRepository.findByIdForUpdate(TARGET_USER)).thenReturn(Optional.of(user(3)));
        when(orgPathResolver.coordinatesOf(OrgNodeRef.department(7L)))
                .thenReturn(OrgCoordinates.ofDepartment(1L, 10L, null, 7L));
        when(userScopeRepository.existsByUserIdAndScopeTypeAndScopeIdAndActiveTrue(
                TARGET_USER, OrgUnitType.DEPARTMENT, 7L)).thenReturn(true);

        assertThatThrownBy(() -> userScopeService.assignScope(TARGET_USER,
                new AssignScopeRequest(OrgUnitType.DEPARTMENT, 7L)))
                .isInstanceOf(UniquenessConflictException.class)
                .extracting("code").isEqualTo("scope.duplicate_assignment");
        verify(userScopeRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("비활성 사용자에게는 범위를 부여할 수 없다")
    void inactiveUserCannotReceiveScope() {
        UserAccount inactive = user(2);
        inactive.setActive(false);
        when(accessGuard.requireRoleLevelAtMost(2)).thenReturn(MANAGER);
        when(userAccountRepository.findByIdForUpdate(TARGET_USER)).thenReturn(Optional.of(inactive));

        assertThatThrownBy(() -> userScopeService.assignScope(TARGET_USER,
                new AssignScopeRequest(OrgUnitType.COMPANY, 10L)))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("user.inactive");
    }

    @Test
    @DisplayName("이미 철회된 범위를 다시 철회해도 변화가 없다")
    void revokeIsIdempotent() {
        UserScope scope = TestEntities.withId(new UserScope(TARGET_USER, OrgNodeRef.branch(100L)), 9L);
        scope.revoke(OffsetDateTime.parse("2024-12-01T00:00:00Z"));
        when(accessGuard.requireRoleLevelAtMost(2)).thenReturn(MANAGER);
        when(userScopeRepository.findByIdAndUserId(9L, TARGET_USER)).thenReturn(Optional.of(scope));

        UserScopeResponse response = userScopeService.revokeScope(TARGET_USER, 9L);

        assertThat(response.active()).isFalse();
        assertThat(response.revokedAt()).isEqualTo(OffsetDateTime.parse("2024-12-01T00:00:00Z"));
        verify(accessGuard, never()).require(any(), any());
    }

    @Test
    @DisplayName("범위 관리 등급이 아니면 다른 사용자의 범위를 볼 수 없다")
    void listingOthersRequiresScopeAdmin() {
        when(accessGuard.currentPrincipal()).thenReturn(AccessPrincipal.unscoped(8L, 3));

        assertThatThrownBy(() -> userScopeService.listScopes(TARGET_USER))
                .isInstanceOf(AuthorizationDeniedException.class);
    }

    private static UserAccount user(int roleLevel) {
        UserAccount user = new UserAccount();
        user.setLoginId("user" + roleLevel);
        user.setDisplayName("User " + roleLevel);
        user.setRoleLevel(roleLevel);
        return TestEntities.withId(user, TARGET_USER);
    }
}
