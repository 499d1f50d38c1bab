package com.procflow.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.procflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One run of an approval template for one entity. At most one instance per entity is {@code OPEN}.
 *
 * <p>{@code status} is the storage lifecycle; {@code outcome} is set when the instance closes and is what
 * callers see. {@code context} keeps a {@code reason} for older readers that only know the status.</p>
 */
@Entity
@Table(name = "approval_instance")
public class ApprovalInstance extends AbstractTimestampedEntity {

    public static final String CONTEXT_REASON = "reason";
    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_NO_APPROVERS = "no_approvers";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "entity_name", nullable = false, updatable = false, length = 64)
    private String entityName;

    @Column(name = "entity_id", nullable = false, updatable = false, length = 128)
    private String entityId;

    @Column(name = "transition_id", updatable = false)
    private UUID transitionId;

    @Column(name = "approval_template_id", nullable = false, updatable = false)
    private UUID approvalTemplateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ApprovalInstanceStatus status = ApprovalInstanceStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 16)
    private ApprovalStatus outcome;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context", columnDefinition = "jsonb")
    private Map<String, Object> context;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "assignment_context", columnDefinition = "jsonb")
    private Map<String, Object> assignmentContext;

    @Column(name = "created_by", nullable = false, updatable = false, length = 128)
    private String createdBy;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public String getEntityName() {
        return entityName;
    }

    public void setEntityName(String entityName) {
        this.entityName = entityName;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public UUID getTransitionId() {
        return transitionId;
    }

    public void setTransitionId(UUID transitionId) {
        this.transitionId = transitionId;
    }

    public UUID getApprovalTemplateId() {
        return approvalTemplateId;
    }

    public void setApprovalTemplateId(UUID approvalTemplateId) {
        this.approvalTemplateId = approvalTemplateId;
    }

    public ApprovalInstanceStatus getStatus() {
        return status;
    }

    public void setStatus(ApprovalInstanceStatus status) {
        this.status = status;
    }

    public ApprovalStatus getOutcome() {
        return outcome;
    }

    public void setOutcome(ApprovalStatus outcome) {
        this.outcome = outcome;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context;
    }

    public Map<String, Object> getAssignmentContext() {
        return assignmentContext;
    }

    public void setAssignmentContext(Map<String, Object> assignmentContext) {
        this.assignmentContext = assignmentContext;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public boolean isOpen() {
        return status == ApprovalInstanceStatus.OPEN;
    }

    public void complete(OffsetDateTime now) {
        this.status = ApprovalInstanceStatus.COMPLETED;
        this.outcome = ApprovalStatus.COMPLETED;
        this.closedAt = now;
    }

    public void reject(OffsetDateTime now) {
        close(ApprovalStatus.REJECTED, REASON_REJECTED, now);
    }

    public void cancel(String reason, OffsetDateTime now) {
        close(ApprovalStatus.CANCELED, reason, now);
    }

    private void close(ApprovalStatus closedOutcome, String reason, OffsetDateTime now) {
        this.status = ApprovalInstanceStatus.CANCELED;
        this.outcome = closedOutcome;
        Map<String, Object> updated = context != null ? new HashMap<>(context) : new HashMap<>();
        updated.put(CONTEXT_REASON, reason);
        this.context = updated;
        this.closedAt = now;
    }
}
