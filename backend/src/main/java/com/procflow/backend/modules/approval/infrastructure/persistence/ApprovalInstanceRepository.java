package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.approval.domain.ApprovalInstance;

public interface ApprovalInstanceRepository extends JpaRepository<ApprovalInstance, UUID> {

    Optional<ApprovalInstance> findByIdAndTenantId(UUID id, UUID tenantId);

    @Query("""
            select i from ApprovalInstance i
             where i.tenantId = :tenantId
               and i.entityName = :entityName
               and i.entityId = :entityId
               and i.status = com.procflow.backend.modules.approval.domain.ApprovalInstanceStatus.OPEN
            """)
    Optional<ApprovalInstance> findOpenForEntity(
            @Param("tenantId") UUID tenantId,
            @Param("entityName") String entityName,
            @Param("entityId") String entityId);

    List<ApprovalInstance> findByTenantIdAndEntityNameAndEntityIdOrderByCreatedAtDesc(
            UUID tenantId,
            String entityName,
            String entityId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from ApprovalInstance i where i.id = :id and i.tenantId = :tenantId")
    Optional<ApprovalInstance> findByIdForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);
}
