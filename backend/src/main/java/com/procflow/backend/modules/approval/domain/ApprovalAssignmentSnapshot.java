package com.procflow.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Approvers resolved for a stage at the moment it was activated. Written once.
 */
@Entity
@Immutable
@Table(name = "approval_assignment_snapshot")
public class ApprovalAssignmentSnapshot {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "approval_instance_id", nullable = false, updatable = false)
    private UUID approvalInstanceId;

    @Column(name = "approval_stage_id", nullable = false, updatable = false)
    private UUID approvalStageId;

    @Column(name = "stage_no", nullable = false, updatable = false)
    private int stageNo;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "resolved_assignees", columnDefinition = "jsonb", nullable = false, updatable = false)
    private List<Map<String, Object>> resolvedAssignees;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "evaluation_context", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> evaluationContext;

    @Column(name = "created_by", nullable = false, updatable = false, length = 128)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getApprovalInstanceId() {
        return approvalInstanceId;
    }

    public void setApprovalInstanceId(UUID approvalInstanceId) {
        this.approvalInstanceId = approvalInstanceId;
    }

    public UUID getApprovalStageId() {
        return approvalStageId;
    }

    public void setApprovalStageId(UUID approvalStageId) {
        this.approvalStageId = approvalStageId;
    }

    public int getStageNo() {
        return stageNo;
    }

    public void setStageNo(int stageNo) {
        this.stageNo = stageNo;
    }

    public List<Map<String, Object>> getResolvedAssignees() {
        return resolvedAssignees;
    }

    public void setResolvedAssignees(List<Map<String, Object>> resolvedAssignees) {
        this.resolvedAssignees = resolvedAssignees;
    }

    public Map<String, Object> getEvaluationContext() {
        return evaluationContext;
    }

    public void setEvaluationContext(Map<String, Object> evaluationContext) {
        this.evaluationContext = evaluationContext;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
