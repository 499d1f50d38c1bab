package com.procflow.backend.modules.lifecycle.application;

import static com.procflow.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.audit.application.AuditLogService;
import com.procflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.procflow.backend.modules.lifecycle.domain.Lifecycle;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEvent;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEventType;
import com.procflow.backend.modules.lifecycle.domain.LifecycleInstance;
import com.procflow.backend.modules.lifecycle.domain.LifecycleState;
import com.procflow.backend.modules.lifecycle.domain.LifecycleTransition;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleEventRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleInstanceRepository;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleTransitionRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LifecycleTransitionServiceTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Mock
    private LifecycleInstanceRepository instanceRepository;

    @Mock
    private LifecycleTransitionRepository transitionRepository;

    @Mock
    private LifecycleEventRepository eventRepository;

    @Mock
    private TransitionGateEvaluator gateEvaluator;

    @Mock
    private AuditLogService auditLogService;

    private LifecycleTransitionService service;
    private RequestContext ctx;

    private LifecycleState draft;
    private LifecycleState approved;
    private LifecycleState closed;
    private LifecycleTransition approve;
    private LifecycleInstance instance;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new LifecycleTransitionService(instanceRepository, transitionRepository, eventRepository,
                gateEvaluator, auditLogService, clock);
        ctx = RequestContext.of("alice", TENANT, List.of("MANAGER"));

        Lifecycle lifecycle = withId(new Lifecycle(), UUID.randomUUID());
        lifecycle.setCode("travel");
        draft = state(lifecycle, "draft", false);
        approved = state(lifecycle, "approved", false);
        closed = state(lifecycle, "closed", true);

        approve = withId(new LifecycleTransition(), UUID.randomUUID());
        approve.setTenantId(TENANT);
        approve.setLifecycle(lifecycle);
        approve.setFromState(draft);
        approve.setToState(approved);
        approve.setOperationCode("APPROVE");
        approve.setActive(true);

        instance = withId(new LifecycleInstance(), UUID.randomUUID());
        instance.setTenantId(TENANT);
        instance.setEntityName("travel_request");
        instance.setEntityId("tr-1");
        instance.setLifecycle(lifecycle);
        instance.setCurrentState(draft);
        instance.setCreatedBy("alice");

        lenient().when(eventRepository.save(any(LifecycleEvent.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0, LifecycleEvent.class), UUID.randomUUID()));
    }

    private static LifecycleState state(Lifecycle lifecycle, String code, boolean terminal) {
        LifecycleState state = withId(new LifecycleState(), UUID.randomUUID());
        state.setTenantId(TENANT);
        state.setLifecycle(lifecycle);
        state.setCode(code);
        state.setName(code);
        state.setTerminal(terminal);
        return state;
    }

    private void givenLockedInstance() {
        when(instanceRepository.findByEntityForUpdate(TENANT, "travel_request", "tr-1"))
                .thenReturn(Optional.of(instance));
    }

    @Test
    @DisplayName("an allowed transition moves the instance and records event and audit")
    void appliesAllowedTransition() {
        givenLockedInstance();
        when(transitionRepository.findActiveTransition(TENANT, draft.getId(), "APPROVE")).thenReturn(Optional.of(approve));
        when(gateEvaluator.validateGates(eq(approve.getId()), eq(ctx), any(), any())).thenReturn(GateDecision.allow());

        TransitionResult result = service.transition(
                new TransitionCommand("travel_request", "tr-1", "APPROVE", Map.of()), ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.fromStateCode()).isEqualTo("draft");
        assertThat(result.toStateCode()).isEqualTo("approved");
        assertThat(result.eventId()).isNotNull();
        assertThat(instance.getCurrentState()).isSameAs(approved);
        assertThat(instance.getUpdatedBy()).isEqualTo("alice");

        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventRepository).save(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(LifecycleEventType.TRANSITION_APPLIED);
        assertThat(event.getValue().getFromStateCode()).isEqualTo("draft");
        assertThat(event.getValue().getToStateCode()).isEqualTo("approved");

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo(LifecycleTransitionService.AUDIT_TRANSITION_APPLIED);
    }

    @Test
    @DisplayName("a blocked transition leaves the instance untouched")
    void blockedTransitionDoesNotMutate() {
        givenLockedInstance();
        when(transitionRepository.findActiveTransition(TENANT, draft.getId(), "APPROVE")).thenReturn(Optional.of(approve));
        when(gateEvaluator.validateGates(eq(approve.getId()), eq(ctx), any(), any()))
                .thenReturn(GateDecision.block(GateDecision.APPROVAL_INITIATED));

        TransitionResult result = service.transition(
                new TransitionCommand("travel_request", "tr-1", "APPROVE", null), ctx);

        assertThat(result).isEqualTo(TransitionResult.rejected("Approval workflow initiated"));
        assertThat(instance.getCurrentState()).isSameAs(draft);
        verifyNoInteractions(eventRepository, auditLogService);
    }

    @Test
    @DisplayName("missing instance, terminal state and unknown operation are refused")
    void refusesInvalidRequests() {
        when(instanceRepository.findByEntityForUpdate(TENANT, "travel_request", "missing")).thenReturn(Optional.empty());
        assertThat(service.transition(new TransitionCommand("travel_request", "missing", "APPROVE", null), ctx).reason())
                .isEqualTo("Lifecycle instance not found for travel_request/missing");

        givenLockedInstance();
        when(transitionRepository.findActiveTransition(TENANT, draft.getId(), "ARCHIVE")).thenReturn(Optional.empty());
        assertThat(service.transition(new TransitionCommand("travel_request", "tr-1", "ARCHIVE", null), ctx).reason())
                .isEqualTo("No transition from 'draft' via 'ARCHIVE'");

        instance.setCurrentState(closed);
        assertThat(service.transition(new TransitionCommand("travel_request", "tr-1", "APPROVE", null), ctx).reason())
                .isEqualTo("State 'closed' is terminal");
        verify(gateEvaluator, never()).validateGates(any(), any(), any(), any());
    }

    @Test
    @DisplayName("resuming replays the stored transition under the system context")
    void resumeAppliesStoredTransition() {
        givenLockedInstance();
        RequestContext system = RequestContext.system("system", TENANT, UUID.randomUUID());
        when(transitionRepository.findByIdAndTenantId(approve.getId(), TENANT)).thenReturn(Optional.of(approve));
        when(transitionRepository.findActiveTransition(TENANT, draft.getId(), "APPROVE")).thenReturn(Optional.of(approve));
        when(gateEvaluator.validateGates(eq(approve.getId()), eq(system), any(), any())).thenReturn(GateDecision.allow());

        TransitionResult result = service.resumeTransition(approve.getId(), "travel_request", "tr-1", Map.of(), system);

        assertThat(result.success()).isTrue();
        assertThat(instance.getCurrentState()).isSameAs(approved);
        assertThat(instance.getUpdatedBy()).isEqualTo("system");
    }

    @Test
    @DisplayName("resuming is refused once the entity has left the transition's source state")
    void resumeRefusedAfterStateChanged() {
        givenLockedInstance();
        instance.setCurrentState(approved);
        LifecycleTransition other = withId(new LifecycleTransition(), UUID.randomUUID());
        other.setOperationCode("APPROVE");
        other.setFromState(approved);
        other.setToState(closed);
        RequestContext system = RequestContext.system("system", TENANT, UUID.randomUUID());
        when(transitionRepository.findByIdAndTenantId(approve.getId(), TENANT)).thenReturn(Optional.of(approve));
        when(transitionRepository.findActiveTransition(TENANT, approved.getId(), "APPROVE")).thenReturn(Optional.of(other));

        TransitionResult result = service.resumeTransition(approve.getId(), "travel_request", "tr-1", Map.of(), system);

        assertThat(result.success()).isFalse();
        assertThat(result.reason()).isEqualTo("Transition " + approve.getId() + " does not leave state 'approved'");
        assertThat(instance.getCurrentState()).isSameAs(approved);
    }

    @Test
    @DisplayName("canTransition previews gates without locking")
    void canTransitionPreviewsGates() {
        when(instanceRepository.findByEntity(TENANT, "travel_request", "tr-1")).thenReturn(Optional.of(instance));
        when(transitionRepository.findActiveTransition(TENANT, draft.getId(), "APPROVE")).thenReturn(Optional.of(approve));
        when(gateEvaluator.previewGates(eq(approve.getId()), eq(ctx), any(), any()))
                .thenReturn(GateDecision.block(GateDecision.APPROVAL_REQUIRED));

        GateDecision decision = service.canTransition(
                new TransitionCommand("travel_request", "tr-1", "APPROVE", Map.of()), ctx);

        assertThat(decision.reason()).isEqualTo("Approval required");
        verify(instanceRepository, never()).findByEntityForUpdate(any(), any(), any());
        assertThat(instance.getCurrentState()).isSameAs(draft);
    }
}
