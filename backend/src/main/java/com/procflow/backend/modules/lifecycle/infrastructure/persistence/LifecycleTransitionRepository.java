package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.lifecycle.domain.LifecycleTransition;

public interface LifecycleTransitionRepository extends JpaRepository<LifecycleTransition, UUID> {

    @Query("""
            select t from LifecycleTransition t
              join fetch t.fromState
              join fetch t.toState
             where t.id = :id
               and t.tenantId = :tenantId
            """)
    Optional<LifecycleTransition> findByIdAndTenantId(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    @Query("""
            select t from LifecycleTransition t
              join fetch t.toState
             where t.tenantId = :tenantId
               and t.fromState.id = :fromStateId
               and t.operationCode = :operationCode
               and t.active = true
            """)
    Optional<LifecycleTransition> findActiveTransition(
            @Param("tenantId") UUID tenantId,
            @Param("fromStateId") UUID fromStateId,
            @Param("operationCode") String operationCode);

    @Query("""
            select t from LifecycleTransition t
              join fetch t.toState
             where t.tenantId = :tenantId
               and t.fromState.id = :fromStateId
               and t.active = true
             order by t.operationCode asc
            """)
    List<LifecycleTransition> findActiveTransitionsFrom(
            @Param("tenantId") UUID tenantId,
            @Param("fromStateId") UUID fromStateId);
}
