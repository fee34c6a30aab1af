package com.orgscope.backend.modules.organization.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.orgscope.backend.modules.organization.domain.Position;

import jakarta.persistence.LockModeType;

public interface PositionRepository extends JpaRepository<Position, Long>, JpaSpecificationExecutor<Position> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select x from Position x where x.id = :id")
    Optional<Position> findByIdForUpdate(@Param("id") Long id);

    List<Position> findByIdIn(Collection<Long> ids);
}
