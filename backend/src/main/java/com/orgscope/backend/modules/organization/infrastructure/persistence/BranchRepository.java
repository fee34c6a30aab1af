package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.organization.domain.Branch;

import jakarta.persistence.LockModeType;

public interface BranchRepository extends JpaRepository<Branch, Long>, JpaSpecificationExecutor<Branch> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select x from Branch x where x.id = :id")
    Optional<Branch> findByIdForUpdate(@Param("id") Long id);

    boolean existsByCompanyIdAndActiveTrue(Long companyId);
}
