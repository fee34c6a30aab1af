package com.orgscope.backend.modules.access.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.access.domain.PermissionGrant;

public interface PermissionGrantRepository extends JpaRepository<PermissionGrant, Long> {

    Optional<PermissionGrant> findFirstByUserIdAndResourcePathAndHttpMethodAndRevokedAtIsNull(
            Long userId,
            String resourcePath,
            String httpMethod);

    List<PermissionGrant> findByUserIdAndRevokedAtIsNullOrderByResourcePathAscHttpMethodAsc(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PermissionGrant g
               set g.revokedAt = :revokedAt
             where g.userId = :userId
               and g.revokedAt is null
            """)
    int revokeAllActive(@Param("userId") Long userId, @Param("revokedAt") OffsetDateTime revokedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PermissionGrant g
               set g.revokedAt = :revokedAt
             where g.userId = :userId
               and g.resourcePath = :resourcePath
               and g.httpMethod = :httpMethod
               and g.revokedAt is null
            """)
    int revokeActive(
            @Param("userId") Long userId,
            @Param("resourcePath") String resourcePath,
            @Param("httpMethod") String httpMethod,
            @Param("revokedAt") OffsetDateTime revokedAt);
}
