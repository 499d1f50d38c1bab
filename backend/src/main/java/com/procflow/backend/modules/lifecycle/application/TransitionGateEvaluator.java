package com.procflow.backend.modules.lifecycle.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.condition.application.ConditionEvaluator;
import com.procflow.backend.modules.condition.application.EvaluationContexts;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGatePort;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGateStatus;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartCommand;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartResult;
import com.procflow.backend.modules.lifecycle.domain.LifecycleTransitionGate;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleTransitionGateRepository;
import com.procflow.backend.modules.policy.application.PolicyGate;
import com.procflow.backend.modules.policy.domain.PolicyDecision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Evaluates the gates attached to a transition.
 *
 * <p>Gates run in {@code sort_order} and the first blocking gate ends evaluation. Within a gate the
 * permission check always runs before the approval check, and a permission denial never touches
 * the approval engine. A gate whose conditions do not match the evaluation context is skipped.</p>
 *
 * <p>The approval branch needs an {@link EntityContext}; without one the approval part of a gate is
 * treated as satisfied. A context carrying the approval bypass flag (set only on the resume path)
 * skips the approval branch entirely.</p>
 */
@Component
public class TransitionGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TransitionGateEvaluator.class);

    private final LifecycleTransitionGateRepository gateRepository;
    private final PolicyGate policyGate;
    private final ApprovalGatePort approvalGatePort;

    public TransitionGateEvaluator(
            LifecycleTransitionGateRepository gateRepository,
            PolicyGate policyGate,
            ApprovalGatePort approvalGatePort
    ) {
        this.gateRepository = gateRepository;
        this.policyGate = policyGate;
        this.approvalGatePort = approvalGatePort;
    }

    @Transactional
    public GateDecision validateGates(UUID transitionId, RequestContext ctx, Map<String, Object> record,
                                      EntityContext entityContext) {
        return evaluate(transitionId, ctx, record, entityContext, false);
    }

    /**
     * Same checks as {@link #validateGates} but never starts an approval workflow.
     * A missing approval is reported as {@value GateDecision#APPROVAL_REQUIRED}.
     */
    @Transactional(readOnly = true)
    public GateDecision previewGates(UUID transitionId, RequestContext ctx, Map<String, Object> record,
                                     EntityContext entityContext) {
        return evaluate(transitionId, ctx, record, entityContext, true);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> requiresApproval(UUID transitionId, UUID tenantId) {
        return gateRepository.findGatesInEvaluationOrder(tenantId, transitionId).stream()
                .map(LifecycleTransitionGate::getApprovalTemplateId)
                .filter(templateId -> templateId != null)
                .findFirst();
    }

    private GateDecision evaluate(UUID transitionId, RequestContext ctx, Map<String, Object> record,
                                  EntityContext entityContext, boolean dryRun) {
        List<LifecycleTransitionGate> gates = gateRepository.findGatesInEvaluationOrder(ctx.tenantId(), transitionId);
        if (gates.isEmpty()) {
            return GateDecision.allow();
        }
        String entityName = entityContext != null ? entityContext.entityName() : null;
        String entityId = entityContext != null ? entityContext.entityId() : null;
        Map<String, Object> evaluationContext = EvaluationContexts.of(record, ctx, entityName, entityId);

        for (LifecycleTransitionGate gate : gates) {
            if (!ConditionEvaluator.matches(gate.getConditions(), evaluationContext)) {
                log.debug("gate_skipped gateId={} transitionId={} reason=conditions_not_met", gate.getId(), transitionId);
                continue;
            }
            GateDecision permission = checkPermissions(gate, entityName, ctx, record);
            if (!permission.allowed()) {
                return permission;
            }
            GateDecision approval = checkApproval(gate, transitionId, ctx, record, entityContext, dryRun);
            if (!approval.allowed()) {
                return approval;
            }
        }
        return GateDecision.allow();
    }

    private GateDecision checkPermissions(LifecycleTransitionGate gate, String entityName, RequestContext ctx,
                                          Map<String, Object> record) {
        if (!gate.hasRequiredOperations()) {
            return GateDecision.allow();
        }
        for (String operation : gate.getRequiredOperations()) {
            PolicyDecision decision = policyGate.authorize(operation, entityName, ctx, record);
            if (!decision.allowed()) {
                String reason = GateDecision.MISSING_OPERATION_PREFIX + operation;
                if (decision.reason() != null && !decision.reason().isBlank()) {
                    reason = reason + " (" + decision.reason() + ")";
                }
                return GateDecision.block(reason);
            }
        }
        return GateDecision.allow();
    }

    private GateDecision checkApproval(LifecycleTransitionGate gate, UUID transitionId, RequestContext ctx,
                                       Map<String, Object> record, EntityContext entityContext, boolean dryRun) {
        if (!gate.requiresApproval() || entityContext == null) {
            return GateDecision.allow();
        }
        if (ctx.approvalBypass()) {
            log.debug("approval_gate_bypassed transitionId={} approvalInstanceId={}",
                    transitionId, ctx.metadata().get(RequestContext.APPROVAL_INSTANCE_ID));
            return GateDecision.allow();
        }

        Optional<ApprovalGateStatus> existing = approvalGatePort.findOpenApprovalStatus(
                ctx.tenantId(), entityContext.entityName(), entityContext.entityId());
        if (existing.isEmpty()) {
            if (dryRun) {
                return GateDecision.block(GateDecision.APPROVAL_REQUIRED);
            }
            ApprovalStartResult started = approvalGatePort.startApproval(
                    new ApprovalStartCommand(entityContext.entityName(), entityContext.entityId(), transitionId,
                            gate.getApprovalTemplateId(), record),
                    ctx);
            if (started.success()) {
                return GateDecision.block(GateDecision.APPROVAL_INITIATED);
            }
            return GateDecision.block(GateDecision.APPROVAL_CREATE_FAILED_PREFIX + started.error());
        }

        return switch (existing.get()) {
            case OPEN -> GateDecision.block(GateDecision.APPROVAL_PENDING);
            case COMPLETED -> GateDecision.allow();
            case REJECTED, CANCELED -> GateDecision.block(GateDecision.APPROVAL_CANCELED);
        };
    }
}
