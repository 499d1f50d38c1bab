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

/**
 * Stage of an approval instance. Mode, quorum and SLA are copied from the template stage at creation,
 * so later template edits do not affect running instances.
 */
@Entity
@Table(name = "approval_stage")
public class ApprovalStage extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "approval_instance_id", nullable = false, updatable = false)
    private UUID approvalInstanceId;

    @Column(name = "stage_no", nullable = false, updatable = false)
    private int stageNo;

    @Column(name = "name", length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    private ApprovalStageMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "quorum_type", length = 16)
    private QuorumType quorumType;

    @Column(name = "quorum_value")
    private Integer quorumValue;

    @Column(name = "sla_minutes")
    private Integer slaMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ApprovalStageStatus status = ApprovalStageStatus.PENDING;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public static ApprovalStage fromTemplate(ApprovalTemplateStage templateStage, UUID instanceId) {
        ApprovalStage stage = new ApprovalStage();
        stage.tenantId = templateStage.getTenantId();
        stage.approvalInstanceId = instanceId;
        stage.stageNo = templateStage.getStageNo();
        stage.name = templateStage.getName();
        stage.mode = templateStage.getMode();
        stage.quorumType = templateStage.getQuorumType();
        stage.quorumValue = templateStage.getQuorumValue();
        stage.slaMinutes = templateStage.getSlaMinutes();
        return stage;
    }

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

    public int getStageNo() {
        return stageNo;
    }

    public void setStageNo(int stageNo) {
        this.stageNo = stageNo;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ApprovalStageMode getMode() {
        return mode;
    }

    public void setMode(ApprovalStageMode mode) {
        this.mode = mode;
    }

    public QuorumType getQuorumType() {
        return quorumType;
    }

    public void setQuorumType(QuorumType quorumType) {
        this.quorumType = quorumType;
    }

    public Integer getQuorumValue() {
        return quorumValue;
    }

    public void setQuorumValue(Integer quorumValue) {
        this.quorumValue = quorumValue;
    }

    public Integer getSlaMinutes() {
        return slaMinutes;
    }

    public void setSlaMinutes(Integer slaMinutes) {
        this.slaMinutes = slaMinutes;
    }

    public ApprovalStageStatus getStatus() {
        return status;
    }

    public void setStatus(ApprovalStageStatus status) {
        this.status = status;
    }

    public OffsetDateTime getActivatedAt() {
        return activatedAt;
    }

    public void setActivatedAt(OffsetDateTime activatedAt) {
        this.activatedAt = activatedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public boolean isActivated() {
        return activatedAt != null;
    }
}
