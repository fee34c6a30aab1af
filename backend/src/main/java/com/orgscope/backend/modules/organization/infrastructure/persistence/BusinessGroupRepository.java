package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.organization.domain.BusinessGroup;

import jakarta.persistence.LockModeType;

public interface BusinessGroupRepository extends JpaRepository<BusinessGroup, Long>, JpaSpecificationExecutor<BusinessGroup> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select x from BusinessGroup x where x.id = :id")
    Optional<BusinessGroup> findByIdForUpdate(@Param("id") Long id);

    boolean existsByCode(String code);
}
