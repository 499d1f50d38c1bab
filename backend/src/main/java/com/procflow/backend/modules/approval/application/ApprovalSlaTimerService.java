package com.procflow.backend.modules.approval.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.transaction.AfterCommit;
import com.procflow.backend.modules.approval.domain.ApprovalEventType;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalSlaTimer;
import com.procflow.backend.modules.approval.domain.ApprovalStageStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTask;
import com.procflow.backend.modules.approval.domain.SlaTimerKind;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalInstanceRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalSlaTimerRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalStageRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTaskRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.SlaTimerOwner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Reminder and escalation timers of approval tasks.
 *
 * <p>Cancellation never takes part in the decision's transaction: it runs after commit in its own
 * transaction and failures are only logged. Timers left behind that way are discarded by the sweep,
 * which fires nothing for a task that is no longer actionable.</p>
 */
@Service
public class ApprovalSlaTimerService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalSlaTimerService.class);

    static final String CANCEL_REASON_TASK_RESOLVED = "task_resolved";

    private final ApprovalSlaTimerRepository timerRepository;
    private final ApprovalTaskRepository taskRepository;
    private final ApprovalStageRepository stageRepository;
    private final ApprovalInstanceRepository instanceRepository;
    private final ApprovalEventLog eventLog;
    private final TransactionTemplate requiresNew;
    private final Clock clock;
    private final double reminderRatio;
    private final int batchSize;
    private final String systemActor;

    public ApprovalSlaTimerService(
            ApprovalSlaTimerRepository timerRepository,
            ApprovalTaskRepository taskRepository,
            ApprovalStageRepository stageRepository,
            ApprovalInstanceRepository instanceRepository,
            ApprovalEventLog eventLog,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${procflow.approval.sla.reminder-ratio:0.75}") double reminderRatio,
            @Value("${procflow.approval.sla.batch-size:100}") int batchSize,
            @Value("${procflow.approval.system-actor:system}") String systemActor
    ) {
        this.timerRepository = timerRepository;
        this.taskRepository = taskRepository;
        this.stageRepository = stageRepository;
        this.instanceRepository = instanceRepository;
        this.eventLog = eventLog;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.reminderRatio = reminderRatio;
        this.batchSize = batchSize;
        this.systemActor = systemActor;
    }

    /**
     * Schedules the reminder and the escalation of a task with a due date. Tasks without one get no timers.
     */
    public List<ApprovalSlaTimer> scheduleTimers(ApprovalTask task, OffsetDateTime activatedAt) {
        if (task.getDueAt() == null) {
            return List.of();
        }
        Duration window = Duration.between(activatedAt, task.getDueAt());
        OffsetDateTime remindAt = activatedAt.plus(Duration.ofMillis((long) (window.toMillis() * reminderRatio)));
        return timerRepository.saveAll(List.of(
                ApprovalSlaTimer.schedule(task, SlaTimerKind.REMINDER, remindAt),
                ApprovalSlaTimer.schedule(task, SlaTimerKind.ESCALATION, task.getDueAt())
        ));
    }

    public void cancelTimersAfterCommit(UUID tenantId, UUID instanceId, UUID taskId) {
        AfterCommit.run(() -> cancelTimers(tenantId, instanceId, taskId));
    }

    /**
     * Cancels the scheduled timers of a task. Safe to repeat; a task without timers is not an error.
     */
    public void cancelTimers(UUID tenantId, UUID instanceId, UUID taskId) {
        try {
            requiresNew.executeWithoutResult(status -> {
                int cancelled = timerRepository.cancelScheduledForTask(taskId, tenantId, OffsetDateTime.now(clock));
                Map<String, Object> payload = new HashMap<>();
                payload.put("taskId", taskId.toString());
                payload.put("reason", CANCEL_REASON_TASK_RESOLVED);
                payload.put("cancelledCount", cancelled);
                eventLog.append(tenantId, instanceId, taskId, ApprovalEventType.SLA_TIMERS_CANCELLED,
                        payload, systemActor);
            });
        } catch (RuntimeException ex) {
            log.warn("approval_sla_timer_cancel_failed instance={} task={}", instanceId, taskId, ex);
        }
    }

    /**
     * Fires every timer that is due, each in its own transaction.
     *
     * @return number of timers fired
     */
    public int fireDueTimers() {
        List<UUID> dueTimerIds = timerRepository.findDueTimerIds(OffsetDateTime.now(clock),
                PageRequest.of(0, batchSize));
        int fired = 0;
        for (UUID timerId : dueTimerIds) {
            try {
                Boolean result = requiresNew.execute(status -> fireTimer(timerId));
                if (Boolean.TRUE.equals(result)) {
                    fired++;
                }
            } catch (RuntimeException ex) {
                log.warn("approval_sla_timer_fire_failed timer={}", timerId, ex);
            }
        }
        return fired;
    }

    boolean fireTimer(UUID timerId) {
        Optional<SlaTimerOwner> owner = timerRepository.findOwnerById(timerId);
        if (owner.isEmpty()) {
            return false;
        }
        // Same lock order as decisions: instance first, then the timer. The timer's status is only
        // trusted from the locked read.
        Optional<ApprovalInstance> instance = instanceRepository.findByIdForUpdate(
                owner.get().approvalInstanceId(), owner.get().tenantId());
        ApprovalSlaTimer timer = timerRepository.findByIdForUpdate(timerId).orElse(null);
        if (timer == null || !timer.isScheduled()) {
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<ApprovalTask> task = taskRepository.findByIdAndTenantId(timer.getApprovalTaskId(), timer.getTenantId());
        if (instance.isEmpty() || !instance.get().isOpen() || task.isEmpty() || !isActionable(task.get())) {
            timer.markCanceled(now);
            log.debug("approval_sla_timer_discarded timer={} task={}", timer.getId(), timer.getApprovalTaskId());
            return false;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("taskId", task.get().getId().toString());
        payload.put("timerId", timer.getId().toString());
        payload.put("dueAt", String.valueOf(task.get().getDueAt()));
        if (task.get().getAssigneePrincipalId() != null) {
            payload.put("assigneePrincipalId", task.get().getAssigneePrincipalId());
        }
        if (task.get().getAssigneeGroupId() != null) {
            payload.put("assigneeGroupId", task.get().getAssigneeGroupId());
        }
        String eventType = timer.getKind() == SlaTimerKind.REMINDER
                ? ApprovalEventType.SLA_REMINDER_SENT
                : ApprovalEventType.SLA_ESCALATION_EXECUTED;
        eventLog.append(timer.getTenantId(), timer.getApprovalInstanceId(), task.get().getId(), eventType,
                payload, systemActor);
        timer.markFired(now);
        log.info("approval_sla_timer_fired kind={} instance={} task={}",
                timer.getKind(), timer.getApprovalInstanceId(), task.get().getId());
        return true;
    }

    private boolean isActionable(ApprovalTask task) {
        if (!task.isPending()) {
            return false;
        }
        return stageRepository.findByIdAndTenantId(task.getApprovalStageId(), task.getTenantId())
                .map(stage -> stage.getStatus() == ApprovalStageStatus.PENDING)
                .orElse(false);
    }
}
