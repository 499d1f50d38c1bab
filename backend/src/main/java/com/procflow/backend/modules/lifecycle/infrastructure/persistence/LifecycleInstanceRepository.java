package com.procflow.backend.modules.lifecycle.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.lifecycle.domain.LifecycleInstance;

public interface LifecycleInstanceRepository extends JpaRepository<LifecycleInstance, UUID> {

    @Query("""
            select i from LifecycleInstance i
              join fetch i.currentState
             where i.tenantId = :tenantId
               and i.entityName = :entityName
               and i.entityId = :entityId
            """)
    Optional<LifecycleInstance> findByEntity(
            @Param("tenantId") UUID tenantId,
            @Param("entityName") String entityName,
            @Param("entityId") String entityId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select i from LifecycleInstance i
             where i.tenantId = :tenantId
               and i.entityName = :entityName
               and i.entityId = :entityId
            """)
    Optional<LifecycleInstance> findByEntityForUpdate(
            @Param("tenantId") UUID tenantId,
            @Param("entityName") String entityName,
            @Param("entityId") String entityId);

    boolean existsByTenantIdAndEntityNameAndEntityId(UUID tenantId, String entityName, String entityId);
}
