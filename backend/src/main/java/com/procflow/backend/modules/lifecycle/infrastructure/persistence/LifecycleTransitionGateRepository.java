package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.lifecycle.domain.LifecycleTransitionGate;

public interface LifecycleTransitionGateRepository extends JpaRepository<LifecycleTransitionGate, UUID> {

    @Query("""
            select g from LifecycleTransitionGate g
             where g.tenantId = :tenantId
               and g.transitionId = :transitionId
             order by g.sortOrder asc, g.createdAt asc, g.id asc
            """)
    List<LifecycleTransitionGate> findGatesInEvaluationOrder(
            @Param("tenantId") UUID tenantId,
            @Param("transitionId") UUID transitionId);
}
