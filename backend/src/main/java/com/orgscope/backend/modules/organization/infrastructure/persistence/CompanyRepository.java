package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.organization.domain.Company;

import jakarta.persistence.LockModeType;

public interface CompanyRepository extends JpaRepository<Company, Long>, JpaSpecificationExecutor<Company> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select x from Company x where x.id = :id")
    Optional<Company> findByIdForUpdate(@Param("id") Long id);

    boolean existsByBusinessGroupIdAndActiveTrue(Long businessGroupId);
}
