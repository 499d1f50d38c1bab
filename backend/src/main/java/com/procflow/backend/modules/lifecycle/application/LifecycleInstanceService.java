package com.procflow.backend.modules.lifecycle.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.global.error.ProblemException;
import com.procflow.backend.modules.audit.application.AuditLogService;
import com.procflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.procflow.backend.modules.lifecycle.domain.Lifecycle;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEvent;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEventType;
import com.procflow.backend.modules.lifecycle.domain.LifecycleInstance;
import com.procflow.backend.modules.lifecycle.domain.LifecycleState;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleEventRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleInstanceRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleStateRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleTransitionRepository;
import com.procflow.backend.modules.lifecycle.presentation.dto.AvailableTransitionResponse;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleDtoMapper;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleEventResponse;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleStateResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LifecycleInstanceService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleInstanceService.class);

    private final LifecycleRepository lifecycleRepository;
    private final LifecycleStateRepository stateRepository;
    private final LifecycleTransitionRepository transitionRepository;
    private final LifecycleInstanceRepository instanceRepository;
    private final LifecycleEventRepository eventRepository;
    private final TransitionGateEvaluator gateEvaluator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LifecycleInstanceService(
            LifecycleRepository lifecycleRepository,
            LifecycleStateRepository stateRepository,
            LifecycleTransitionRepository transitionRepository,
            LifecycleInstanceRepository instanceRepository,
            LifecycleEventRepository eventRepository,
            TransitionGateEvaluator gateEvaluator,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.lifecycleRepository = lifecycleRepository;
        this.stateRepository = stateRepository;
        this.transitionRepository = transitionRepository;
        this.instanceRepository = instanceRepository;
        this.eventRepository = eventRepository;
        this.gateEvaluator = gateEvaluator;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Places an entity at the start of a lifecycle: the first state flagged initial, else the lowest sort order.
     */
    @Transactional
    public LifecycleStateResponse createInstance(String entityName, String entityId, String lifecycleCode,
                                                 RequestContext ctx) {
        Lifecycle lifecycle = lifecycleRepository.findByTenantIdAndCodeAndActiveTrue(ctx.tenantId(), lifecycleCode)
                .orElseThrow(() -> ProblemException.notFound("LIFECYCLE_NOT_FOUND",
                        "Lifecycle '" + lifecycleCode + "' not found"));
        if (instanceRepository.existsByTenantIdAndEntityNameAndEntityId(ctx.tenantId(), entityName, entityId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "LIFECYCLE_INSTANCE_EXISTS",
                    "Lifecycle instance already exists for " + entityName + "/" + entityId);
        }
        LifecycleState initialState = stateRepository.findStartCandidates(lifecycle.getId(), ctx.tenantId()).stream()
                .findFirst()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "LIFECYCLE_HAS_NO_STATES",
                        "Lifecycle '" + lifecycleCode + "' defines no states"));

        LifecycleInstance instance = new LifecycleInstance();
        instance.setTenantId(ctx.tenantId());
        instance.setEntityName(entityName);
        instance.setEntityId(entityId);
        instance.setLifecycle(lifecycle);
        instance.setCurrentState(initialState);
        instance.setCreatedBy(ctx.userId());
        instance.setUpdatedBy(ctx.userId());
        LifecycleInstance saved = instanceRepository.saveAndFlush(instance);

        LifecycleEvent event = new LifecycleEvent();
        event.setTenantId(ctx.tenantId());
        event.setLifecycleInstanceId(saved.getId());
        event.setEntityName(entityName);
        event.setEntityId(entityId);
        event.setEventType(LifecycleEventType.INSTANCE_CREATED);
        event.setToStateCode(initialState.getCode());
        event.setActorId(ctx.userId());
        event.setPayload(Map.of("lifecycleCode", lifecycleCode));
        event.setOccurredAt(OffsetDateTime.now(clock));
        eventRepository.save(event);

        auditLogService.record(new AuditLogCommand(
                ctx.tenantId(),
                "LIFECYCLE_INSTANCE_CREATED",
                LifecycleTransitionService.AUDIT_RESOURCE_TYPE,
                saved.getId().toString(),
                ctx.userId(),
                null,
                Map.of("entityName", entityName, "entityId", entityId, "state", initialState.getCode())
        ));
        log.info("lifecycle_instance_created entity={}/{} lifecycle={} state={}",
                entityName, entityId, lifecycleCode, initialState.getCode());
        return LifecycleDtoMapper.toStateResponse(saved);
    }

    @Transactional(readOnly = true)
    public Optional<LifecycleStateResponse> getCurrentState(String entityName, String entityId, UUID tenantId) {
        return instanceRepository.findByEntity(tenantId, entityName, entityId)
                .map(LifecycleDtoMapper::toStateResponse);
    }

    @Transactional(readOnly = true)
    public List<AvailableTransitionResponse> getAvailableTransitions(String entityName, String entityId,
                                                                     UUID tenantId) {
        LifecycleInstance instance = instanceRepository.findByEntity(tenantId, entityName, entityId)
                .orElseThrow(() -> instanceNotFound(entityName, entityId));
        if (instance.getCurrentState().isTerminal()) {
            return List.of();
        }
        return transitionRepository.findActiveTransitionsFrom(tenantId, instance.getCurrentState().getId()).stream()
                .map(transition -> LifecycleDtoMapper.toAvailableTransition(transition,
                        gateEvaluator.requiresApproval(transition.getId(), tenantId).orElse(null)))
                .toList();
    }

    /**
     * Lifecycle events for the entity, newest first.
     */
    @Transactional(readOnly = true)
    public List<LifecycleEventResponse> getHistory(String entityName, String entityId, UUID tenantId) {
        return eventRepository.findByTenantIdAndEntityNameAndEntityIdOrderByOccurredAtDescIdDesc(
                        tenantId, entityName, entityId).stream()
                .map(LifecycleDtoMapper::toEventResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean isTerminalState(UUID stateId, UUID tenantId) {
        return stateRepository.findByIdAndTenantId(stateId, tenantId)
                .map(LifecycleState::isTerminal)
                .orElse(false);
    }

    private static ProblemException instanceNotFound(String entityName, String entityId) {
        return ProblemException.notFound("LIFECYCLE_INSTANCE_NOT_FOUND",
                "Lifecycle instance not found for " + entityName + "/" + entityId);
    }
}
