package com.procflow.backend.modules.lifecycle.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.audit.application.AuditLogService;
import com.procflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.procflow.backend.modules.lifecycle.application.port.TransitionResumer;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEvent;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEventType;
import com.procflow.backend.modules.lifecycle.domain.LifecycleInstance;
import com.procflow.backend.modules.lifecycle.domain.LifecycleState;
import com.procflow.backend.modules.lifecycle.domain.LifecycleTransition;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleEventRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleInstanceRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleTransitionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves an entity's lifecycle instance along a transition once every gate allows it.
 * The lifecycle instance row is locked for the duration, so transitions of one entity are serialized.
 */
@Service
public class LifecycleTransitionService implements TransitionResumer {

    private static final Logger log = LoggerFactory.getLogger(LifecycleTransitionService.class);

    static final String AUDIT_TRANSITION_APPLIED = "LIFECYCLE_TRANSITION_APPLIED";
    static final String AUDIT_RESOURCE_TYPE = "LIFECYCLE_INSTANCE";

    private final LifecycleInstanceRepository instanceRepository;
    private final LifecycleTransitionRepository transitionRepository;
    private final LifecycleEventRepository eventRepository;
    private final TransitionGateEvaluator gateEvaluator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LifecycleTransitionService(
            LifecycleInstanceRepository instanceRepository,
            LifecycleTransitionRepository transitionRepository,
            LifecycleEventRepository eventRepository,
            TransitionGateEvaluator gateEvaluator,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.instanceRepository = instanceRepository;
        this.transitionRepository = transitionRepository;
        this.eventRepository = eventRepository;
        this.gateEvaluator = gateEvaluator;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public TransitionResult transition(TransitionCommand command, RequestContext ctx) {
        return apply(command, ctx, null);
    }

    /**
     * Replays a transition that an approval gate blocked earlier. The entity must still be in the
     * transition's source state; otherwise the resume is refused rather than applying a different transition.
     */
    @Override
    @Transactional
    public TransitionResult resumeTransition(UUID transitionId, String entityName, String entityId,
                                             Map<String, Object> record, RequestContext ctx) {
        Optional<LifecycleTransition> stored = transitionRepository.findByIdAndTenantId(transitionId, ctx.tenantId());
        if (stored.isEmpty()) {
            return TransitionResult.rejected("Transition not found: " + transitionId);
        }
        TransitionCommand command = new TransitionCommand(entityName, entityId,
                stored.get().getOperationCode(), record);
        return apply(command, ctx, transitionId);
    }

    /**
     * Dry run of {@link #transition}: same lookups and gates, no lock, no approval workflow started, no mutation.
     */
    @Transactional(readOnly = true)
    public GateDecision canTransition(TransitionCommand command, RequestContext ctx) {
        Optional<LifecycleInstance> instance = instanceRepository.findByEntity(
                ctx.tenantId(), command.entityName(), command.entityId());
        if (instance.isEmpty()) {
            return GateDecision.block(instanceNotFound(command));
        }
        LifecycleState current = instance.get().getCurrentState();
        if (current.isTerminal()) {
            return GateDecision.block(terminalState(current));
        }
        Optional<LifecycleTransition> transition = transitionRepository.findActiveTransition(
                ctx.tenantId(), current.getId(), command.operationCode());
        if (transition.isEmpty()) {
            return GateDecision.block(noTransition(current, command.operationCode()));
        }
        return gateEvaluator.previewGates(transition.get().getId(), ctx, command.record(),
                new EntityContext(command.entityName(), command.entityId()));
    }

    private TransitionResult apply(TransitionCommand command, RequestContext ctx, UUID expectedTransitionId) {
        Optional<LifecycleInstance> locked = instanceRepository.findByEntityForUpdate(
                ctx.tenantId(), command.entityName(), command.entityId());
        if (locked.isEmpty()) {
            return TransitionResult.rejected(instanceNotFound(command));
        }
        LifecycleInstance instance = locked.get();
        LifecycleState current = instance.getCurrentState();
        if (current.isTerminal()) {
            return TransitionResult.rejected(terminalState(current));
        }
        Optional<LifecycleTransition> candidate = transitionRepository.findActiveTransition(
                ctx.tenantId(), current.getId(), command.operationCode());
        if (candidate.isEmpty()) {
            return TransitionResult.rejected(noTransition(current, command.operationCode()));
        }
        LifecycleTransition transition = candidate.get();
        if (expectedTransitionId != null && !expectedTransitionId.equals(transition.getId())) {
            return TransitionResult.rejected("Transition " + expectedTransitionId
                    + " does not leave state '" + current.getCode() + "'");
        }

        GateDecision decision = gateEvaluator.validateGates(transition.getId(), ctx, command.record(),
                new EntityContext(command.entityName(), command.entityId()));
        if (!decision.allowed()) {
            log.info("lifecycle_transition_blocked entity={}/{} operation={} reason={}",
                    command.entityName(), command.entityId(), command.operationCode(), decision.reason());
            return TransitionResult.rejected(decision.reason());
        }

        LifecycleState target = transition.getToState();
        instance.setCurrentState(target);
        instance.setUpdatedBy(ctx.userId());

        LifecycleEvent event = eventRepository.save(buildEvent(instance, transition, current, target, ctx));

        Map<String, Object> detail = new HashMap<>();
        detail.put("transitionId", transition.getId().toString());
        detail.put("operationCode", transition.getOperationCode());
        detail.put("fromState", current.getCode());
        detail.put("toState", target.getCode());
        detail.put("entityName", command.entityName());
        detail.put("entityId", command.entityId());
        if (ctx.approvalBypass()) {
            detail.put("approvalInstanceId", ctx.metadata().get(RequestContext.APPROVAL_INSTANCE_ID));
        }
        auditLogService.record(new AuditLogCommand(
                ctx.tenantId(),
                AUDIT_TRANSITION_APPLIED,
                AUDIT_RESOURCE_TYPE,
                instance.getId().toString(),
                ctx.userId(),
                transition.getId(),
                detail
        ));

        log.info("lifecycle_transition_applied entity={}/{} operation={} from={} to={} actor={}",
                command.entityName(), command.entityId(), transition.getOperationCode(),
                current.getCode(), target.getCode(), ctx.userId());
        return TransitionResult.applied(current.getCode(), target.getCode(), event.getId());
    }

    private LifecycleEvent buildEvent(LifecycleInstance instance, LifecycleTransition transition,
                                      LifecycleState from, LifecycleState to, RequestContext ctx) {
        LifecycleEvent event = new LifecycleEvent();
        event.setTenantId(instance.getTenantId());
        event.setLifecycleInstanceId(instance.getId());
        event.setEntityName(instance.getEntityName());
        event.setEntityId(instance.getEntityId());
        event.setEventType(LifecycleEventType.TRANSITION_APPLIED);
        event.setTransitionId(transition.getId());
        event.setOperationCode(transition.getOperationCode());
        event.setFromStateCode(from.getCode());
        event.setToStateCode(to.getCode());
        event.setActorId(ctx.userId());
        Map<String, Object> payload = new HashMap<>();
        payload.put("realmId", ctx.realmId());
        payload.put("approvalBypass", ctx.approvalBypass());
        event.setPayload(payload);
        event.setOccurredAt(OffsetDateTime.now(clock));
        return event;
    }

    private static String instanceNotFound(TransitionCommand command) {
        return "Lifecycle instance not found for " + command.entityName() + "/" + command.entityId();
    }

    private static String terminalState(LifecycleState state) {
        return "State '" + state.getCode() + "' is terminal";
    }

    private static String noTransition(LifecycleState state, String operationCode) {
        return "No transition from '" + state.getCode() + "' via '" + operationCode + "'";
    }
}
