package com.procflow.backend.modules.approval.application;

import static com.procflow.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
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

import com.procflow.backend.modules.approval.domain.ApprovalDecision;
import com.procflow.backend.modules.approval.domain.ApprovalEventType;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalSlaTimer;
import com.procflow.backend.modules.approval.domain.ApprovalStage;
import com.procflow.backend.modules.approval.domain.ApprovalTask;
import com.procflow.backend.modules.approval.domain.SlaTimerKind;
import com.procflow.backend.modules.approval.domain.SlaTimerStatus;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalInstanceRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalSlaTimerRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalStageRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTaskRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.SlaTimerOwner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class ApprovalSlaTimerServiceTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-000000000004");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-04-01T12:00:00Z");

    @Mock
    private ApprovalSlaTimerRepository timerRepository;

    @Mock
    private ApprovalTaskRepository taskRepository;

    @Mock
    private ApprovalStageRepository stageRepository;

    @Mock
    private ApprovalInstanceRepository instanceRepository;

    @Mock
    private ApprovalEventLog eventLog;

    @Mock
    private PlatformTransactionManager transactionManager;

    private ApprovalSlaTimerService service;
    private ApprovalInstance instance;
    private ApprovalStage stage;
    private ApprovalTask task;

    @BeforeEach
    void setUp() {
        service = new ApprovalSlaTimerService(timerRepository, taskRepository, stageRepository, instanceRepository,
                eventLog, transactionManager, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), 0.75, 50, "system");

        instance = withId(new ApprovalInstance(), UUID.randomUUID());
        instance.setTenantId(TENANT);
        stage = withId(new ApprovalStage(), UUID.randomUUID());
        stage.setTenantId(TENANT);
        stage.setApprovalInstanceId(instance.getId());
        task = withId(new ApprovalTask(), UUID.randomUUID());
        task.setTenantId(TENANT);
        task.setApprovalInstanceId(instance.getId());
        task.setApprovalStageId(stage.getId());
        task.setAssigneePrincipalId("bob");
    }

    @Test
    @DisplayName("a reminder lands at three quarters of the window and the escalation at the due date")
    void schedulesReminderAndEscalation() {
        OffsetDateTime activatedAt = NOW.minusHours(1);
        task.setDueAt(activatedAt.plusHours(4));
        when(timerRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<ApprovalSlaTimer> timers = service.scheduleTimers(task, activatedAt);

        assertThat(timers).extracting(ApprovalSlaTimer::getKind)
                .containsExactly(SlaTimerKind.REMINDER, SlaTimerKind.ESCALATION);
        assertThat(timers.get(0).getFireAt()).isEqualTo(activatedAt.plusHours(3));
        assertThat(timers.get(1).getFireAt()).isEqualTo(task.getDueAt());
        assertThat(timers).allMatch(ApprovalSlaTimer::isScheduled);
    }

    @Test
    @DisplayName("tasks without a due date get no timers")
    void noDueDateNoTimers() {
        assertThat(service.scheduleTimers(task, NOW)).isEmpty();
        verifyNoInteractions(timerRepository);
    }

    @Test
    @DisplayName("a due timer of a pending task fires and is marked fired")
    void firesDueTimer() {
        ApprovalSlaTimer timer = withId(ApprovalSlaTimer.schedule(task, SlaTimerKind.REMINDER, NOW.minusMinutes(1)),
                UUID.randomUUID());
        givenDueTimer(timer);
        when(taskRepository.findByIdAndTenantId(task.getId(), TENANT)).thenReturn(Optional.of(task));
        when(stageRepository.findByIdAndTenantId(stage.getId(), TENANT)).thenReturn(Optional.of(stage));

        int fired = service.fireDueTimers();

        assertThat(fired).isEqualTo(1);
        assertThat(timer.getStatus()).isEqualTo(SlaTimerStatus.FIRED);
        assertThat(timer.getFiredAt()).isEqualTo(NOW);
        verify(eventLog).append(eq(TENANT), eq(instance.getId()), eq(task.getId()),
                eq(ApprovalEventType.SLA_REMINDER_SENT), any(), eq("system"));
    }

    @Test
    @DisplayName("a timer whose task was already decided is discarded without an event")
    void discardsStaleTimer() {
        ApprovalSlaTimer timer = withId(ApprovalSlaTimer.schedule(task, SlaTimerKind.ESCALATION, NOW.minusMinutes(1)),
                UUID.randomUUID());
        task.decide(ApprovalDecision.APPROVE, "bob", null, NOW.minusMinutes(30));
        givenDueTimer(timer);
        when(taskRepository.findByIdAndTenantId(task.getId(), TENANT)).thenReturn(Optional.of(task));

        assertThat(service.fireDueTimers()).isZero();
        assertThat(timer.getStatus()).isEqualTo(SlaTimerStatus.CANCELED);
        verifyNoInteractions(eventLog);
    }

    @Test
    @DisplayName("a timer fired by another sweep while waiting for the lock is left alone")
    void skipsTimerFiredConcurrently() {
        ApprovalSlaTimer seenAsDue = withId(ApprovalSlaTimer.schedule(task, SlaTimerKind.REMINDER,
                NOW.minusMinutes(1)), UUID.randomUUID());
        ApprovalSlaTimer locked = withId(ApprovalSlaTimer.schedule(task, SlaTimerKind.REMINDER,
                NOW.minusMinutes(1)), seenAsDue.getId());
        locked.markFired(NOW.minusSeconds(5));
        when(timerRepository.findDueTimerIds(eq(NOW), any(Pageable.class))).thenReturn(List.of(seenAsDue.getId()));
        when(timerRepository.findOwnerById(seenAsDue.getId()))
                .thenReturn(Optional.of(new SlaTimerOwner(instance.getId(), TENANT)));
        when(instanceRepository.findByIdForUpdate(instance.getId(), TENANT)).thenReturn(Optional.of(instance));
        when(timerRepository.findByIdForUpdate(seenAsDue.getId())).thenReturn(Optional.of(locked));

        assertThat(service.fireDueTimers()).isZero();
        assertThat(locked.getStatus()).isEqualTo(SlaTimerStatus.FIRED);
        assertThat(locked.getFiredAt()).isEqualTo(NOW.minusSeconds(5));
        verify(timerRepository, never()).findById(any());
        verifyNoInteractions(eventLog, taskRepository);
    }

    @Test
    @DisplayName("resolving a task cancels its timers and records how many were cancelled")
    void cancelsTimersOfResolvedTask() {
        when(timerRepository.cancelScheduledForTask(task.getId(), TENANT, NOW)).thenReturn(2);

        // No transaction is active, so the cancellation runs straight away.
        service.cancelTimersAfterCommit(TENANT, instance.getId(), task.getId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventLog).append(eq(TENANT), eq(instance.getId()), eq(task.getId()),
                eq(ApprovalEventType.SLA_TIMERS_CANCELLED), payload.capture(), eq("system"));
        assertThat(payload.getValue())
                .containsEntry("cancelledCount", 2)
                .containsEntry("reason", "task_resolved");
    }

    @Test
    @DisplayName("a failed cancellation is logged, not thrown")
    void cancellationFailureIsContained() {
        when(timerRepository.cancelScheduledForTask(task.getId(), TENANT, NOW))
                .thenThrow(new QueryTimeoutException("lock timeout"));

        assertThatCode(() -> service.cancelTimers(TENANT, instance.getId(), task.getId())).doesNotThrowAnyException();
        verifyNoInteractions(eventLog);
    }

    private void givenDueTimer(ApprovalSlaTimer timer) {
        when(timerRepository.findDueTimerIds(eq(NOW), any(Pageable.class))).thenReturn(List.of(timer.getId()));
        when(timerRepository.findOwnerById(timer.getId()))
                .thenReturn(Optional.of(new SlaTimerOwner(instance.getId(), TENANT)));
        when(instanceRepository.findByIdForUpdate(instance.getId(), TENANT)).thenReturn(Optional.of(instance));
        when(timerRepository.findByIdForUpdate(timer.getId())).thenReturn(Optional.of(timer));
    }
}
