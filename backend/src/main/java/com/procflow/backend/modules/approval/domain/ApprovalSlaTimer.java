package com.procflow.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "approval_sla_timer")
public class ApprovalSlaTimer {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "approval_instance_id", nullable = false, updatable = false)
    private UUID approvalInstanceId;

    @Column(name = "approval_task_id", nullable = false, updatable = false)
    private UUID approvalTaskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16, updatable = false)
    private SlaTimerKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SlaTimerStatus status = SlaTimerStatus.SCHEDULED;

    @Column(name = "fire_at", nullable = false, updatable = false)
    private OffsetDateTime fireAt;

    @Column(name = "fired_at")
    private OffsetDateTime firedAt;

    @Column(name = "canceled_at")
    private OffsetDateTime canceledAt;

    public static ApprovalSlaTimer schedule(ApprovalTask task, SlaTimerKind kind, OffsetDateTime fireAt) {
        ApprovalSlaTimer timer = new ApprovalSlaTimer();
        timer.tenantId = task.getTenantId();
        timer.approvalInstanceId = task.getApprovalInstanceId();
        timer.approvalTaskId = task.getId();
        timer.kind = kind;
        timer.fireAt = fireAt;
        return timer;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getApprovalInstanceId() {
        return approvalInstanceId;
    }

    public UUID getApprovalTaskId() {
        return approvalTaskId;
    }

    public SlaTimerKind getKind() {
        return kind;
    }

    public SlaTimerStatus getStatus() {
        return status;
    }

    public OffsetDateTime getFireAt() {
        return fireAt;
    }

    public OffsetDateTime getFiredAt() {
        return firedAt;
    }

    public OffsetDateTime getCanceledAt() {
        return canceledAt;
    }

    public boolean isScheduled() {
        return status == SlaTimerStatus.SCHEDULED;
    }

    public void markFired(OffsetDateTime now) {
        this.status = SlaTimerStatus.FIRED;
        this.firedAt = now;
    }

    public void markCanceled(OffsetDateTime now) {
        this.status = SlaTimerStatus.CANCELED;
        this.canceledAt = now;
    }
}
