package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.lifecycle.domain.LifecycleState;

public interface LifecycleStateRepository extends JpaRepository<LifecycleState, UUID> {

    Optional<LifecycleState> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * States flagged initial come first; within each group the lowest {@code sortOrder} wins.
     */
    @Query("""
            select s from LifecycleState s
             where s.lifecycle.id = :lifecycleId
               and s.tenantId = :tenantId
             order by s.initial desc, s.sortOrder asc, s.code asc
            """)
    List<LifecycleState> findStartCandidates(
            @Param("lifecycleId") UUID lifecycleId,
            @Param("tenantId") UUID tenantId);
}
