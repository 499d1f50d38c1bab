package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.approval.domain.ApprovalEvent;

public interface ApprovalEventRepository extends JpaRepository<ApprovalEvent, UUID> {

    @Query("""
            select e from ApprovalEvent e
             where e.approvalInstanceId = :instanceId
               and e.tenantId = :tenantId
             order by e.occurredAt asc, e.seq asc
            """)
    List<ApprovalEvent> findTimeline(@Param("instanceId") UUID instanceId, @Param("tenantId") UUID tenantId);

    long countByApprovalInstanceIdAndEventType(UUID approvalInstanceId, String eventType);
}
