package com.procflow.backend.modules.approval.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.approval.domain.ApprovalEventType;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalStage;
import com.procflow.backend.modules.approval.domain.ApprovalStageStatus;
import com.procflow.backend.modules.approval.domain.ApprovalStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTask;
import com.procflow.backend.modules.approval.domain.ApprovalTaskType;
import com.procflow.backend.modules.approval.domain.StageCompletionPolicy;
import com.procflow.backend.modules.approval.domain.StageEvaluation;
import com.procflow.backend.modules.approval.domain.StageOutcome;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalInstanceRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalStageRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTaskRepository;
import com.procflow.backend.modules.audit.application.AuditLogService;
import com.procflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.procflow.backend.modules.lifecycle.application.TransitionResult;
import com.procflow.backend.modules.lifecycle.application.port.TransitionResumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records approver decisions and drives stage and instance completion.
 *
 * <p>Every decision locks its approval instance before touching the task, so decisions on one instance
 * are serialized and exactly one of them can observe the final stage completing. That decision closes the
 * instance and resumes the blocked lifecycle transition in the same transaction.</p>
 */
@Service
public class ApprovalDecisionService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalDecisionService.class);

    static final String AUDIT_DECISION_MADE = "APPROVAL_DECISION_MADE";
    static final String AUDIT_INSTANCE_COMPLETED = "APPROVAL_INSTANCE_COMPLETED";
    static final String AUDIT_INSTANCE_REJECTED = "APPROVAL_INSTANCE_REJECTED";
    static final String AUDIT_RESOURCE_TYPE = "APPROVAL_INSTANCE";

    private final ApprovalTaskRepository taskRepository;
    private final ApprovalInstanceRepository instanceRepository;
    private final ApprovalStageRepository stageRepository;
    private final ApprovalStageActivator stageActivator;
    private final ApprovalSlaTimerService slaTimerService;
    private final ApprovalEventLog eventLog;
    private final AuditLogService auditLogService;
    private final TransitionResumer transitionResumer;
    private final Clock clock;
    private final String systemActor;

    public ApprovalDecisionService(
            ApprovalTaskRepository taskRepository,
            ApprovalInstanceRepository instanceRepository,
            ApprovalStageRepository stageRepository,
            ApprovalStageActivator stageActivator,
            ApprovalSlaTimerService slaTimerService,
            ApprovalEventLog eventLog,
            AuditLogService auditLogService,
            TransitionResumer transitionResumer,
            Clock clock,
            @Value("${procflow.approval.system-actor:system}") String systemActor
    ) {
        this.taskRepository = taskRepository;
        this.instanceRepository = instanceRepository;
        this.stageRepository = stageRepository;
        this.stageActivator = stageActivator;
        this.slaTimerService = slaTimerService;
        this.eventLog = eventLog;
        this.auditLogService = auditLogService;
        this.transitionResumer = transitionResumer;
        this.clock = clock;
        this.systemActor = systemActor;
    }

    @Transactional
    public ApprovalDecisionResult makeDecision(ApprovalDecisionCommand command, RequestContext ctx) {
        UUID tenantId = ctx.tenantId();
        UUID taskId = command.taskId();
        if (command.decision() == null) {
            return ApprovalDecisionResult.failed(taskId, "Decision is required");
        }
        Optional<UUID> instanceId = taskRepository.findInstanceIdByTaskId(taskId, tenantId);
        if (instanceId.isEmpty()) {
            return ApprovalDecisionResult.failed(taskId, "Task not found");
        }
        Optional<ApprovalInstance> lockedInstance = instanceRepository.findByIdForUpdate(instanceId.get(), tenantId);
        Optional<ApprovalTask> loadedTask = taskRepository.findByIdAndTenantId(taskId, tenantId);
        if (lockedInstance.isEmpty() || loadedTask.isEmpty()) {
            return ApprovalDecisionResult.failed(taskId, "Task not found");
        }
        ApprovalInstance instance = lockedInstance.get();
        ApprovalTask task = loadedTask.get();
        if (!task.isPending()) {
            return ApprovalDecisionResult.failed(taskId, "Task not pending (current: " + task.getStatus() + ")");
        }
        if (task.getTaskType() == ApprovalTaskType.OBSERVER) {
            return ApprovalDecisionResult.failed(taskId, "Observer tasks cannot be decided");
        }
        if (!instance.isOpen()) {
            return ApprovalDecisionResult.failed(taskId, "Approval instance is not open (current: "
                    + instance.getStatus() + ")");
        }
        Optional<ApprovalStage> loadedStage = stageRepository.findByIdAndTenantId(task.getApprovalStageId(), tenantId);
        if (loadedStage.isEmpty() || loadedStage.get().getStatus() != ApprovalStageStatus.PENDING) {
            return ApprovalDecisionResult.failed(taskId, "Stage is no longer accepting decisions");
        }
        ApprovalStage stage = loadedStage.get();

        OffsetDateTime now = OffsetDateTime.now(clock);
        task.decide(command.decision(), ctx.userId(), command.note(), now);
        slaTimerService.cancelTimersAfterCommit(tenantId, instance.getId(), task.getId());

        Map<String, Object> decisionPayload = new HashMap<>();
        decisionPayload.put("taskId", task.getId().toString());
        decisionPayload.put("stageNo", stage.getStageNo());
        decisionPayload.put("decision", command.decision().name());
        decisionPayload.put("note", command.note());
        eventLog.append(tenantId, instance.getId(), task.getId(), ApprovalEventType.forDecision(command.decision()),
                decisionPayload, ctx.userId());
        audit(ctx, AUDIT_DECISION_MADE, instance, decisionPayload);

        List<ApprovalTask> stageTasks = taskRepository.findByApprovalStageIdAndTenantId(stage.getId(), tenantId)
                .stream()
                .filter(candidate -> candidate.getTaskType() == ApprovalTaskType.APPROVER)
                .toList();
        StageEvaluation evaluation = StageCompletionPolicy.evaluate(stage.getMode(), stage.getQuorumType(),
                stage.getQuorumValue(), stageTasks.stream().map(ApprovalTask::getStatus).toList());
        if (!evaluation.complete()) {
            return ApprovalDecisionResult.recorded(task.getId(), task.getStatus());
        }

        closeStage(stage, evaluation.outcome(), stageTasks, instance, ctx, now);
        if (evaluation.outcome() == StageOutcome.REJECTED) {
            return rejectInstance(instance, task, stage, ctx, now);
        }

        boolean morePending = stageRepository
                .findByApprovalInstanceIdAndTenantIdOrderByStageNoAsc(instance.getId(), tenantId)
                .stream()
                .anyMatch(candidate -> candidate.getStatus() == ApprovalStageStatus.PENDING);
        if (morePending) {
            stageActivator.activateNextStageAfterCommit(instance.getId(), tenantId);
            return ApprovalDecisionResult.stageClosed(task.getId(), task.getStatus(), StageOutcome.COMPLETED,
                    null, false);
        }
        return completeInstance(instance, task, ctx, now);
    }

    private void closeStage(ApprovalStage stage, StageOutcome outcome, List<ApprovalTask> stageTasks,
                            ApprovalInstance instance, RequestContext ctx, OffsetDateTime now) {
        stage.setStatus(outcome == StageOutcome.COMPLETED ? ApprovalStageStatus.COMPLETED : ApprovalStageStatus.CANCELED);
        stage.setCompletedAt(now);
        // Undecided tasks of a closed stage can no longer act; their timers go too.
        stageTasks.stream()
                .filter(ApprovalTask::isPending)
                .forEach(open -> slaTimerService.cancelTimersAfterCommit(instance.getTenantId(), instance.getId(),
                        open.getId()));

        Map<String, Object> payload = new HashMap<>();
        payload.put("stageId", stage.getId().toString());
        payload.put("stageNo", stage.getStageNo());
        payload.put("outcome", outcome.name());
        String eventType = outcome == StageOutcome.COMPLETED
                ? ApprovalEventType.STAGE_COMPLETED
                : ApprovalEventType.STAGE_REJECTED;
        eventLog.append(instance.getTenantId(), instance.getId(), null, eventType, payload, ctx.userId());
    }

    private ApprovalDecisionResult rejectInstance(ApprovalInstance instance, ApprovalTask task, ApprovalStage stage,
                                                  RequestContext ctx, OffsetDateTime now) {
        instance.reject(now);
        Map<String, Object> payload = new HashMap<>();
        payload.put("rejectedTaskId", task.getId().toString());
        payload.put("stageNo", stage.getStageNo());
        eventLog.append(instance.getTenantId(), instance.getId(), task.getId(), ApprovalEventType.INSTANCE_REJECTED,
                payload, ctx.userId());
        audit(ctx, AUDIT_INSTANCE_REJECTED, instance, payload);
        log.info("approval_instance_rejected instance={} entity={}/{} task={}",
                instance.getId(), instance.getEntityName(), instance.getEntityId(), task.getId());
        return ApprovalDecisionResult.stageClosed(task.getId(), task.getStatus(), StageOutcome.REJECTED,
                ApprovalStatus.REJECTED, false);
    }

    private ApprovalDecisionResult completeInstance(ApprovalInstance instance, ApprovalTask task,
                                                    RequestContext ctx, OffsetDateTime now) {
        instance.complete(now);
        Map<String, Object> payload = new HashMap<>();
        payload.put("completedBy", ctx.userId());
        payload.put("transitionId", instance.getTransitionId() != null ? instance.getTransitionId().toString() : null);
        eventLog.append(instance.getTenantId(), instance.getId(), task.getId(), ApprovalEventType.INSTANCE_COMPLETED,
                payload, ctx.userId());
        audit(ctx, AUDIT_INSTANCE_COMPLETED, instance, payload);
        log.info("approval_instance_completed instance={} entity={}/{}",
                instance.getId(), instance.getEntityName(), instance.getEntityId());

        boolean triggered = instance.getTransitionId() != null && resumeTransition(instance);
        return ApprovalDecisionResult.stageClosed(task.getId(), task.getStatus(), StageOutcome.COMPLETED,
                ApprovalStatus.COMPLETED, triggered);
    }

    private boolean resumeTransition(ApprovalInstance instance) {
        RequestContext systemCtx = RequestContext.system(systemActor, instance.getTenantId(), instance.getId());
        Map<String, Object> record = instance.getAssignmentContext() != null
                ? instance.getAssignmentContext()
                : Map.of();
        TransitionResult result = transitionResumer.resumeTransition(instance.getTransitionId(),
                instance.getEntityName(), instance.getEntityId(), record, systemCtx);

        Map<String, Object> payload = new HashMap<>();
        payload.put("transitionId", instance.getTransitionId().toString());
        if (result.success()) {
            payload.put("fromState", result.fromStateCode());
            payload.put("toState", result.toStateCode());
            payload.put("lifecycleEventId", result.eventId() != null ? result.eventId().toString() : null);
            eventLog.append(instance.getTenantId(), instance.getId(), null, ApprovalEventType.LIFECYCLE_RESUMED,
                    payload, systemActor);
            return true;
        }
        payload.put("reason", result.reason());
        eventLog.append(instance.getTenantId(), instance.getId(), null, ApprovalEventType.LIFECYCLE_RESUME_FAILED,
                payload, systemActor);
        log.warn("approval_lifecycle_resume_failed instance={} entity={}/{} reason={}",
                instance.getId(), instance.getEntityName(), instance.getEntityId(), result.reason());
        return false;
    }

    private void audit(RequestContext ctx, String actionType, ApprovalInstance instance, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                instance.getTenantId(),
                actionType,
                AUDIT_RESOURCE_TYPE,
                instance.getId().toString(),
                ctx.userId(),
                instance.getTransitionId(),
                detail
        ));
    }
}
