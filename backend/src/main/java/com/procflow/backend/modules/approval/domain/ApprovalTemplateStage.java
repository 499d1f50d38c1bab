package com.procflow.backend.modules.approval.domain;

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
@Table(name = "approval_template_stage")
public class ApprovalTemplateStage extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "approval_template_id", nullable = false)
    private UUID approvalTemplateId;

    @Column(name = "stage_no", nullable = false)
    private int stageNo;

    @Column(name = "name", length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    private ApprovalStageMode mode = ApprovalStageMode.ALL;

    @Enumerated(EnumType.STRING)
    @Column(name = "quorum_type", length = 16)
    private QuorumType quorumType;

    @Column(name = "quorum_value")
    private Integer quorumValue;

    @Column(name = "sla_minutes")
    private Integer slaMinutes;

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
}
