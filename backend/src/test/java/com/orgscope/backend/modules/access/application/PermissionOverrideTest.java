package com.orgscope.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.domain.PermissionGrant;
import com.orgscope.backend.modules.access.infrastructure.persistence.PermissionGrantRepository;

@ExtendWith(MockitoExtension.class)
class PermissionOverrideTest {

    @Mock
    private PermissionGrantRepository permissionGrantRepository;

    private PermissionOverride permissionOverride;

    @BeforeEach
    void setUp() {
        permissionOverride = new PermissionOverride(permissionGrantRepository, AccessPolicyProperties.defaults());
    }

    @Test
    @DisplayName("정확한 경로의 재정의가 기본 경로보다 우선한다")
    void exactPathWins() {
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                5L, "/api/v1/employees/7", "GET"))
                .thenReturn(Optional.of(new PermissionGrant(5L, "/api/v1/employees/7", "GET", false)));

        assertThat(permissionOverride.lookup(5L, "/api/v1/employees/7/", "get")).contains(false);
        verify(permissionGrantRepository, never())
                .findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(5L, "/api/v1/employees", "GET");
    }

    @Test
    @DisplayName("정확한 경로가 없으면 기본 경로로 대체한다")
    void fallsBackToBasePath() {
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                5L, "/api/v1/employees/7/subordinates", "GET"))
                .thenReturn(Optional.empty());
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                5L, "/api/v1/employees", "GET"))
                .thenReturn(Optional.of(new PermissionGrant(5L, "/api/v1/employees", "GET", true)));

        assertThat(permissionOverride.lookup(5L, "/api/v1/employees/7/subordinates?page=2", "GET")).contains(true);
    }

    @Test
    @DisplayName("일치하는 재정의가 없으면 비어 있다")
    void emptyWhenNothingMatches() {
        when(permissionGrantRepository.findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
                5L, "/api/v1/companies", "POST"))
                .thenReturn(Optional.empty());

        assertThat(permissionOverride.lookup(5L, "/api/v1/companies", "POST")).isEmpty();
        assertThat(permissionOverride.lookup(null, "/api/v1/companies", "POST")).isEmpty();
    }

    @Test
    @DisplayName("경로와 메서드를 정규화한다")
    void normalization() {
        assertThat(PermissionOverride.normalizePath(" /api/v1/branches/3/?x=1 ")).isEqualTo("/api/v1/branches/3");
        assertThat(PermissionOverride.normalizePath("/")).isEqualTo("/");
        assertThat(PermissionOverride.normalizeMethod(" patch ")).isEqualTo("PATCH");
        assertThat(PermissionOverride.basePath("/api/v1/branches/3", 3)).isEqualTo("/api/v1/branches");
        assertThat(PermissionOverride.basePath("/api/v1", 3)).isEqualTo("/api/v1");
    }
}
