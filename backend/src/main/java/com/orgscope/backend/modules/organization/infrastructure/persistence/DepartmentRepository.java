package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.organization.domain.Department;

import jakarta.persistence.LockModeType;

public interface DepartmentRepository extends JpaRepository<Department, Long>, JpaSpecificationExecutor<Department> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Department d where d.id = :id")
    Optional<Department> findByIdForUpdate(@Param("id") Long id);

    @Query("select d.companyId from Department d where d.id = :id")
    Optional<Long> findCompanyIdById(@Param("id") Long id);

    @Query("select d.id from Department d where d.parentId = :parentId order by d.id")
    List<Long> findChildIds(@Param("parentId") Long parentId);

    List<Department> findByParentIdOrderByNameAsc(Long parentId);

    List<Department> findByIdIn(Collection<Long> ids);

    boolean existsByParentIdAndActiveTrue(Long parentId);

    boolean existsByCompanyIdAndActiveTrue(Long companyId);

    boolean existsByBranchIdAndActiveTrue(Long branchId);
}
