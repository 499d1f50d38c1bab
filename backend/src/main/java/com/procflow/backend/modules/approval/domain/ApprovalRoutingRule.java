package com.procflow.backend.modules.approval.domain;

import java.util.Map;
import java.util.UUID;

import com.procflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Routes a template stage to approvers. A {@code null} stage number applies the rule to every stage;
 * lower priority values are tried first.
 */
@Entity
@Table(name = "approval_routing_rule")
public class ApprovalRoutingRule extends AbstractTimestampedEntity {

    public static final int DEFAULT_PRIORITY = 100;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "approval_template_id", nullable = false)
    private UUID approvalTemplateId;

    @Column(name = "stage_no")
    private Integer stageNo;

    @Column(name = "priority", nullable = false)
    private int priority = DEFAULT_PRIORITY;

    @Column(name = "is_fallback", nullable = false)
    private boolean fallback;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conditions", columnDefinition = "jsonb")
    private Map<String, Object> conditions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "assign_to", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> assignTo;

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getApprovalTemplateId() {
        return approvalTemplateId;
    }

    public void setApprovalTemplateId(UUID approvalTemplateId) {
        this.approvalTemplateId = approvalTemplateId;
    }

    public Integer getStageNo() {
        return stageNo;
    }

    public void setStageNo(Integer stageNo) {
        this.stageNo = stageNo;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isFallback() {
        return fallback;
    }

    public void setFallback(boolean fallback) {
        this.fallback = fallback;
    }

    public Map<String, Object> getConditions() {
        return conditions;
    }

    public void setConditions(Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public Map<String, Object> getAssignTo() {
        return assignTo;
    }

    public void setAssignTo(Map<String, Object> assignTo) {
        this.assignTo = assignTo;
    }

    public boolean appliesToStage(int candidateStageNo) {
        return stageNo == null || stageNo == candidateStageNo;
    }
}
