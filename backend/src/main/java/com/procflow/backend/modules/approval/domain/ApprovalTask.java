package com.procflow.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.procflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "approval_task")
public class ApprovalTask extends AbstractTimestampedEntity {

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

    @Column(name = "assignee_principal_id", length = 128)
    private String assigneePrincipalId;

    @Column(name = "assignee_group_id", length = 128)
    private String assigneeGroupId;

    @Column(name = "resolved_from_rule_id")
    private UUID resolvedFromRuleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 16)
    private ApprovalTaskType taskType = ApprovalTaskType.APPROVER;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ApprovalTaskStatus status = ApprovalTaskStatus.PENDING;

    @Column(name = "decided_by", length = 128)
    private String decidedBy;

    @Column(name = "decision_note", length = 2000)
    private String decisionNote;

    @Column(name = "due_at")
    private OffsetDateTime dueAt;

    @Column(name = "decided_at")
    private OffsetDateTime decidedAt;

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

    public String getAssigneePrincipalId() {
        return assigneePrincipalId;
    }

    public void setAssigneePrincipalId(String assigneePrincipalId) {
        this.assigneePrincipalId = assigneePrincipalId;
    }

    public String getAssigneeGroupId() {
        return assigneeGroupId;
    }

    public void setAssigneeGroupId(String assigneeGroupId) {
        this.assigneeGroupId = assigneeGroupId;
    }

    public UUID getResolvedFromRuleId() {
        return resolvedFromRuleId;
    }

    public void setResolvedFromRuleId(UUID resolvedFromRuleId) {
        this.resolvedFromRuleId = resolvedFromRuleId;
    }

    public ApprovalTaskType getTaskType() {
        return taskType;
    }

    public void setTaskType(ApprovalTaskType taskType) {
        this.taskType = taskType;
    }

    public ApprovalTaskStatus getStatus() {
        return status;
    }

    public void setStatus(ApprovalTaskStatus status) {
        this.status = status;
    }

    public String getDecidedBy() {
        return decidedBy;
    }

    public String getDecisionNote() {
        return decisionNote;
    }

    public OffsetDateTime getDueAt() {
        return dueAt;
    }

    public void setDueAt(OffsetDateTime dueAt) {
        this.dueAt = dueAt;
    }

    public OffsetDateTime getDecidedAt() {
        return decidedAt;
    }

    public boolean isPending() {
        return status == ApprovalTaskStatus.PENDING;
    }

    public void decide(ApprovalDecision decision, String actorId, String note, OffsetDateTime now) {
        if (!isPending()) {
            throw new IllegalStateException("Task " + id + " is already " + status);
        }
        this.status = decision == ApprovalDecision.APPROVE ? ApprovalTaskStatus.APPROVED : ApprovalTaskStatus.REJECTED;
        this.decidedBy = actorId;
        this.decisionNote = note;
        this.decidedAt = now;
    }
}
