package com.orgscope.backend.modules.employee.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.employee.domain.Employee;

import jakarta.persistence.LockModeType;

public interface EmployeeRepository extends JpaRepository<Employee, Long>, JpaSpecificationExecutor<Employee> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Employee e where e.id = :id")
    Optional<Employee> findByIdForUpdate(@Param("id") Long id);

    @Query("select e.companyId from Employee e where e.id = :id")
    Optional<Long> findCompanyIdById(@Param("id") Long id);

    @Query("select e.id from Employee e where e.supervisorId = :supervisorId order by e.id")
    List<Long> findSubordinateIds(@Param("supervisorId") Long supervisorId);

    List<Employee> findBySupervisorId(Long supervisorId);

    List<Employee> findByIdIn(Collection<Long> ids);

    boolean existsBySupervisorIdAndActiveTrue(Long supervisorId);

    boolean existsByDepartmentIdAndActiveTrue(Long departmentId);

    boolean existsByBranchIdAndActiveTrue(Long branchId);

    boolean existsByPositionIdAndActiveTrue(Long positionId);

    boolean existsByCompanyIdAndActiveTrue(Long companyId);

    Optional<Employee> findFirstByUserIdAndActiveTrue(Long userId);
}
