package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.approval.domain.ApprovalSlaTimer;

public interface ApprovalSlaTimerRepository extends JpaRepository<ApprovalSlaTimer, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApprovalSlaTimer t
               set t.status = com.procflow.backend.modules.approval.domain.SlaTimerStatus.CANCELED,
                   t.canceledAt = :now
             where t.approvalTaskId = :taskId
               and t.tenantId = :tenantId
               and t.status = com.procflow.backend.modules.approval.domain.SlaTimerStatus.SCHEDULED
            """)
    int cancelScheduledForTask(
            @Param("taskId") UUID taskId,
            @Param("tenantId") UUID tenantId,
            @Param("now") OffsetDateTime now);

    @Query("""
            select t.id from ApprovalSlaTimer t
             where t.status = com.procflow.backend.modules.approval.domain.SlaTimerStatus.SCHEDULED
               and t.fireAt <= :now
             order by t.fireAt asc
            """)
    List<UUID> findDueTimerIds(@Param("now") OffsetDateTime now, Pageable pageable);

    /**
     * Owner of a timer as scalars, so the timer entity is first loaded by the locked read.
     */
    @Query("""
            select new com.procflow.backend.modules.approval.infrastructure.persistence.SlaTimerOwner(
                       t.approvalInstanceId, t.tenantId)
              from ApprovalSlaTimer t
             where t.id = :id
            """)
    Optional<SlaTimerOwner> findOwnerById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from ApprovalSlaTimer t where t.id = :id")
    Optional<ApprovalSlaTimer> findByIdForUpdate(@Param("id") UUID id);

    List<ApprovalSlaTimer> findByApprovalTaskIdAndTenantIdOrderByFireAtAsc(UUID approvalTaskId, UUID tenantId);
}
