package com.procflow.backend.modules.lifecycle.domain;

import java.util.ArrayList;
import java.util.List;
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
 * One gate on a transition. All gates of a transition must pass; they are evaluated by {@code sortOrder}.
 */
@Entity
@Table(name = "lifecycle_transition_gate")
public class LifecycleTransitionGate extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "transition_id", nullable = false)
    private UUID transitionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "required_operations", columnDefinition = "jsonb")
    private List<String> requiredOperations;

    @Column(name = "approval_template_id")
    private UUID approvalTemplateId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conditions", columnDefinition = "jsonb")
    private Map<String, Object> conditions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "threshold_rules", columnDefinition = "jsonb")
    private List<Map<String, Object>> thresholdRules;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    public UUID getId() {
        return id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public UUID getTransitionId() {
        return transitionId;
    }

    public void setTransitionId(UUID transitionId) {
        this.transitionId = transitionId;
    }

    public List<String> getRequiredOperations() {
        return requiredOperations;
    }

    public void setRequiredOperations(List<String> requiredOperations) {
        this.requiredOperations = requiredOperations != null ? new ArrayList<>(requiredOperations) : null;
    }

    public UUID getApprovalTemplateId() {
        return approvalTemplateId;
    }

    public void setApprovalTemplateId(UUID approvalTemplateId) {
        this.approvalTemplateId = approvalTemplateId;
    }

    public Map<String, Object> getConditions() {
        return conditions;
    }

    public void setConditions(Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public List<Map<String, Object>> getThresholdRules() {
        return thresholdRules;
    }

    public void setThresholdRules(List<Map<String, Object>> thresholdRules) {
        this.thresholdRules = thresholdRules;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public boolean hasRequiredOperations() {
        return requiredOperations != null && !requiredOperations.isEmpty();
    }

    public boolean requiresApproval() {
        return approvalTemplateId != null;
    }
}
