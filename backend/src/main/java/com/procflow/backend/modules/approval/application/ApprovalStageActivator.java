package com.procflow.backend.modules.approval.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.transaction.AfterCommit;
import com.procflow.backend.modules.approval.domain.ApprovalAssignmentSnapshot;
import com.procflow.backend.modules.approval.domain.ApprovalEventType;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalStage;
import com.procflow.backend.modules.approval.domain.ApprovalStageStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTask;
import com.procflow.backend.modules.approval.domain.ApprovalTaskType;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalAssignmentSnapshotRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalInstanceRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalRoutingRuleRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalStageRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTaskRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Opens a stage for decisions: creates its approver tasks, their SLA timers and the assignment snapshot.
 *
 * <p>The first stage is activated inside instance creation. Later stages are activated after the decision
 * that approved the previous stage has committed, in a separate transaction holding the instance lock.</p>
 */
@Component
public class ApprovalStageActivator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalStageActivator.class);

    private final ApprovalInstanceRepository instanceRepository;
    private final ApprovalStageRepository stageRepository;
    private final ApprovalTaskRepository taskRepository;
    private final ApprovalAssignmentSnapshotRepository snapshotRepository;
    private final ApprovalRoutingRuleRepository routingRuleRepository;
    private final ApproverResolver approverResolver;
    private final ApprovalSlaTimerService slaTimerService;
    private final ApprovalEventLog eventLog;
    private final TransactionTemplate requiresNew;
    private final Clock clock;
    private final String systemActor;

    public ApprovalStageActivator(
            ApprovalInstanceRepository instanceRepository,
            ApprovalStageRepository stageRepository,
            ApprovalTaskRepository taskRepository,
            ApprovalAssignmentSnapshotRepository snapshotRepository,
            ApprovalRoutingRuleRepository routingRuleRepository,
            ApproverResolver approverResolver,
            ApprovalSlaTimerService slaTimerService,
            ApprovalEventLog eventLog,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${procflow.approval.system-actor:system}") String systemActor
    ) {
        this.instanceRepository = instanceRepository;
        this.stageRepository = stageRepository;
        this.taskRepository = taskRepository;
        this.snapshotRepository = snapshotRepository;
        this.routingRuleRepository = routingRuleRepository;
        this.approverResolver = approverResolver;
        this.slaTimerService = slaTimerService;
        this.eventLog = eventLog;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.systemActor = systemActor;
    }

    public List<ApprovalTask> activate(ApprovalInstance instance, ApprovalStage stage,
                                       List<ResolvedAssignee> assignees, Map<String, Object> evaluationContext,
                                       String actorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        stage.setActivatedAt(now);
        stageRepository.save(stage);

        OffsetDateTime dueAt = stage.getSlaMinutes() != null && stage.getSlaMinutes() > 0
                ? now.plusMinutes(stage.getSlaMinutes())
                : null;
        List<ApprovalTask> tasks = new ArrayList<>(assignees.size());
        for (ResolvedAssignee assignee : assignees) {
            ApprovalTask task = new ApprovalTask();
            task.setTenantId(instance.getTenantId());
            task.setApprovalInstanceId(instance.getId());
            task.setApprovalStageId(stage.getId());
            task.setAssigneePrincipalId(assignee.principalId());
            task.setAssigneeGroupId(assignee.groupId());
            task.setResolvedFromRuleId(assignee.ruleId());
            task.setTaskType(ApprovalTaskType.APPROVER);
            task.setDueAt(dueAt);
            tasks.add(task);
        }
        List<ApprovalTask> saved = taskRepository.saveAll(tasks);
        saved.forEach(task -> slaTimerService.scheduleTimers(task, now));

        ApprovalAssignmentSnapshot snapshot = new ApprovalAssignmentSnapshot();
        snapshot.setTenantId(instance.getTenantId());
        snapshot.setApprovalInstanceId(instance.getId());
        snapshot.setApprovalStageId(stage.getId());
        snapshot.setStageNo(stage.getStageNo());
        snapshot.setResolvedAssignees(assignees.stream().map(ResolvedAssignee::toSnapshotEntry).toList());
        snapshot.setEvaluationContext(evaluationContext != null ? new HashMap<>(evaluationContext) : null);
        snapshot.setCreatedBy(actorId);
        snapshot.setCreatedAt(now);
        snapshotRepository.save(snapshot);

        Map<String, Object> payload = new HashMap<>();
        payload.put("stageId", stage.getId() != null ? stage.getId().toString() : null);
        payload.put("stageNo", stage.getStageNo());
        payload.put("taskCount", saved.size());
        eventLog.append(instance.getTenantId(), instance.getId(), null, ApprovalEventType.STAGE_ACTIVATED,
                payload, actorId);
        return saved;
    }

    /**
     * Activates the next stage once the current transaction commits. Failures are logged; the instance then
     * stays open with an inactive stage until an operator intervenes.
     */
    public void activateNextStageAfterCommit(UUID instanceId, UUID tenantId) {
        AfterCommit.run(() -> {
            try {
                requiresNew.executeWithoutResult(status -> activateNextStage(instanceId, tenantId));
            } catch (RuntimeException ex) {
                log.error("approval_stage_activation_failed instance={}", instanceId, ex);
            }
        });
    }

    void activateNextStage(UUID instanceId, UUID tenantId) {
        Optional<ApprovalInstance> locked = instanceRepository.findByIdForUpdate(instanceId, tenantId);
        if (locked.isEmpty() || !locked.get().isOpen()) {
            return;
        }
        ApprovalInstance instance = locked.get();
        Optional<ApprovalStage> next = stageRepository
                .findByApprovalInstanceIdAndTenantIdOrderByStageNoAsc(instanceId, tenantId)
                .stream()
                .filter(stage -> stage.getStatus() == ApprovalStageStatus.PENDING)
                .findFirst();
        if (next.isEmpty() || next.get().isActivated()) {
            return;
        }
        ApprovalStage stage = next.get();
        Map<String, Object> evaluationContext = instance.getAssignmentContext() != null
                ? instance.getAssignmentContext()
                : Map.of();
        List<ResolvedAssignee> assignees = approverResolver.resolve(
                routingRuleRepository.findRulesInPriorityOrder(instance.getApprovalTemplateId(), tenantId),
                stage.getStageNo(),
                evaluationContext);
        if (assignees.isEmpty()) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            stage.setStatus(ApprovalStageStatus.CANCELED);
            stage.setCompletedAt(now);
            instance.cancel(ApprovalInstance.REASON_NO_APPROVERS, now);
            Map<String, Object> payload = new HashMap<>();
            payload.put("reason", ApprovalInstance.REASON_NO_APPROVERS);
            payload.put("stageNo", stage.getStageNo());
            eventLog.append(tenantId, instanceId, null, ApprovalEventType.INSTANCE_CANCELED, payload, systemActor);
            log.warn("approval_instance_canceled instance={} reason={} stage={}",
                    instanceId, ApprovalInstance.REASON_NO_APPROVERS, stage.getStageNo());
            return;
        }
        activate(instance, stage, assignees, evaluationContext, systemActor);
        log.info("approval_stage_activated instance={} stage={} tasks={}",
                instanceId, stage.getStageNo(), assignees.size());
    }
}
