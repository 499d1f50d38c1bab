package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.approval.domain.ApprovalRoutingRule;

public interface ApprovalRoutingRuleRepository extends JpaRepository<ApprovalRoutingRule, UUID> {

    @Query("""
            select r from ApprovalRoutingRule r
             where r.approvalTemplateId = :templateId
               and r.tenantId = :tenantId
             order by r.priority asc, r.createdAt asc
            """)
    List<ApprovalRoutingRule> findRulesInPriorityOrder(
            @Param("templateId") UUID templateId,
            @Param("tenantId") UUID tenantId);
}
