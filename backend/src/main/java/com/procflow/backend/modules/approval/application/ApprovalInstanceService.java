package com.procflow.backend.modules.approval.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.approval.domain.ApprovalEventType;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalRoutingRule;
import com.procflow.backend.modules.approval.domain.ApprovalStage;
import com.procflow.backend.modules.approval.domain.ApprovalStatus;
import com.procflow.backend.modules.approval.domain.ApprovalStatusMapper;
import com.procflow.backend.modules.approval.domain.ApprovalTask;
import com.procflow.backend.modules.approval.domain.ApprovalTemplate;
import com.procflow.backend.modules.approval.domain.ApprovalTemplateStage;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalAssignmentSnapshotRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalEventRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalInstanceRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalRoutingRuleRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalStageRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTaskRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTemplateRepository;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalTemplateStageRepository;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalDtoMapper;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalEventResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalInstanceResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalTaskListResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalTaskResponse;
import com.procflow.backend.modules.approval.presentation.dto.AssignmentSnapshotResponse;
import com.procflow.backend.modules.audit.application.AuditLogService;
import com.procflow.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.procflow.backend.modules.condition.application.EvaluationContexts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates approval instances and answers tenant-scoped reads about them.
 *
 * <p>Creation validates everything (template, stages, existing open instance, first-stage approvers)
 * before the first insert, so a failed creation leaves nothing behind.</p>
 */
@Service
public class ApprovalInstanceService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalInstanceService.class);

    static final String AUDIT_INSTANCE_CREATED = "APPROVAL_INSTANCE_CREATED";
    static final String AUDIT_RESOURCE_TYPE = "APPROVAL_INSTANCE";

    private final ApprovalTemplateRepository templateRepository;
    private final ApprovalTemplateStageRepository templateStageRepository;
    private final ApprovalRoutingRuleRepository routingRuleRepository;
    private final ApprovalInstanceRepository instanceRepository;
    private final ApprovalStageRepository stageRepository;
    private final ApprovalTaskRepository taskRepository;
    private final ApprovalAssignmentSnapshotRepository snapshotRepository;
    private final ApprovalEventRepository eventRepository;
    private final ApproverResolver approverResolver;
    private final ApprovalStageActivator stageActivator;
    private final ApprovalEventLog eventLog;
    private final AuditLogService auditLogService;

    public ApprovalInstanceService(
            ApprovalTemplateRepository templateRepository,
            ApprovalTemplateStageRepository templateStageRepository,
            ApprovalRoutingRuleRepository routingRuleRepository,
            ApprovalInstanceRepository instanceRepository,
            ApprovalStageRepository stageRepository,
            ApprovalTaskRepository taskRepository,
            ApprovalAssignmentSnapshotRepository snapshotRepository,
            ApprovalEventRepository eventRepository,
            ApproverResolver approverResolver,
            ApprovalStageActivator stageActivator,
            ApprovalEventLog eventLog,
            AuditLogService auditLogService
    ) {
        this.templateRepository = templateRepository;
        this.templateStageRepository = templateStageRepository;
        this.routingRuleRepository = routingRuleRepository;
        this.instanceRepository = instanceRepository;
        this.stageRepository = stageRepository;
        this.taskRepository = taskRepository;
        this.snapshotRepository = snapshotRepository;
        this.eventRepository = eventRepository;
        this.approverResolver = approverResolver;
        this.stageActivator = stageActivator;
        this.eventLog = eventLog;
        this.auditLogService = auditLogService;
    }

    @Transactional
    public ApprovalCreationResult createApprovalInstance(ApprovalCreationCommand command, RequestContext ctx) {
        UUID tenantId = ctx.tenantId();
        Optional<ApprovalTemplate> template = templateRepository.findByIdAndTenantId(
                command.approvalTemplateId(), tenantId);
        if (template.isEmpty()) {
            return ApprovalCreationResult.failed("Template not found");
        }
        List<ApprovalTemplateStage> templateStages = templateStageRepository
                .findByApprovalTemplateIdAndTenantIdOrderByStageNoAsc(command.approvalTemplateId(), tenantId);
        if (templateStages.isEmpty()) {
            return ApprovalCreationResult.failed("Template has no stages");
        }
        if (instanceRepository.findOpenForEntity(tenantId, command.entityName(), command.entityId()).isPresent()) {
            return ApprovalCreationResult.failed("An open approval instance already exists for "
                    + command.entityName() + "/" + command.entityId());
        }

        Map<String, Object> evaluationContext = EvaluationContexts.of(command.record(), ctx,
                command.entityName(), command.entityId());
        List<ApprovalRoutingRule> rules = routingRuleRepository.findRulesInPriorityOrder(
                command.approvalTemplateId(), tenantId);
        ApprovalTemplateStage firstTemplateStage = templateStages.get(0);
        List<ResolvedAssignee> assignees = approverResolver.resolve(rules, firstTemplateStage.getStageNo(),
                evaluationContext);
        if (assignees.isEmpty()) {
            return ApprovalCreationResult.failed("No approvers resolved for stage " + firstTemplateStage.getStageNo());
        }

        ApprovalInstance instance = new ApprovalInstance();
        instance.setTenantId(tenantId);
        instance.setEntityName(command.entityName());
        instance.setEntityId(command.entityId());
        instance.setTransitionId(command.transitionId());
        instance.setApprovalTemplateId(command.approvalTemplateId());
        instance.setContext(new HashMap<>());
        instance.setAssignmentContext(evaluationContext);
        instance.setCreatedBy(ctx.userId());
        instance = instanceRepository.save(instance);

        List<ApprovalStage> stages = new ArrayList<>(templateStages.size());
        for (ApprovalTemplateStage templateStage : templateStages) {
            stages.add(ApprovalStage.fromTemplate(templateStage, instance.getId()));
        }
        stages = stageRepository.saveAll(stages);

        Map<String, Object> payload = new HashMap<>();
        payload.put("entityName", command.entityName());
        payload.put("entityId", command.entityId());
        payload.put("transitionId", command.transitionId() != null ? command.transitionId().toString() : null);
        payload.put("templateCode", template.get().getCode());
        payload.put("stageCount", stages.size());
        payload.put("taskCount", assignees.size());
        eventLog.append(tenantId, instance.getId(), null, ApprovalEventType.INSTANCE_CREATED, payload, ctx.userId());

        List<ApprovalTask> tasks = stageActivator.activate(instance, stages.get(0), assignees, evaluationContext,
                ctx.userId());

        auditLogService.record(new AuditLogCommand(
                tenantId,
                AUDIT_INSTANCE_CREATED,
                AUDIT_RESOURCE_TYPE,
                instance.getId().toString(),
                ctx.userId(),
                command.transitionId(),
                payload
        ));
        log.info("approval_instance_created instance={} entity={}/{} template={} stages={} tasks={}",
                instance.getId(), command.entityName(), command.entityId(), template.get().getCode(),
                stages.size(), tasks.size());
        return ApprovalCreationResult.created(instance.getId(), stages.size(), tasks.size());
    }

    @Transactional(readOnly = true)
    public Optional<ApprovalInstanceResponse> getInstance(UUID instanceId, UUID tenantId) {
        return instanceRepository.findByIdAndTenantId(instanceId, tenantId)
                .map(this::toInstanceResponse);
    }

    /**
     * The open instance of an entity. Closed instances are not returned.
     */
    @Transactional(readOnly = true)
    public Optional<ApprovalInstanceResponse> getInstanceForEntity(String entityName, String entityId, UUID tenantId) {
        return instanceRepository.findOpenForEntity(tenantId, entityName, entityId)
                .map(this::toInstanceResponse);
    }

    @Transactional(readOnly = true)
    public Optional<ApprovalStatus> findOpenStatus(UUID tenantId, String entityName, String entityId) {
        return instanceRepository.findOpenForEntity(tenantId, entityName, entityId)
                .map(ApprovalStatusMapper::toExternalStatus);
    }

    @Transactional(readOnly = true)
    public Optional<ApprovalTaskResponse> getTask(UUID taskId, UUID tenantId) {
        return taskRepository.findByIdAndTenantId(taskId, tenantId)
                .map(ApprovalDtoMapper::toTaskResponse);
    }

    @Transactional(readOnly = true)
    public List<ApprovalTaskResponse> getTasksForInstance(UUID instanceId, UUID tenantId) {
        return taskRepository.findByApprovalInstanceIdAndTenantIdOrderByCreatedAtAsc(instanceId, tenantId)
                .stream()
                .map(ApprovalDtoMapper::toTaskResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public ApprovalTaskListResponse getTasksForUser(String principalId, UUID tenantId, int page, int size) {
        Page<ApprovalTask> tasks = taskRepository.findActionableTasks(tenantId, principalId, PageRequest.of(page, size));
        return new ApprovalTaskListResponse(
                tasks.getContent().stream().map(ApprovalDtoMapper::toTaskResponse).toList(),
                tasks.getNumber(),
                tasks.getSize(),
                tasks.getTotalElements()
        );
    }

    @Transactional(readOnly = true)
    public Optional<AssignmentSnapshotResponse> getAssignmentSnapshot(UUID instanceId, int stageNo, UUID tenantId) {
        return snapshotRepository.findByApprovalInstanceIdAndTenantIdAndStageNo(instanceId, tenantId, stageNo)
                .map(ApprovalDtoMapper::toSnapshotResponse);
    }

    @Transactional(readOnly = true)
    public List<ApprovalEventResponse> getEvents(UUID instanceId, UUID tenantId) {
        return eventRepository.findTimeline(instanceId, tenantId).stream()
                .map(ApprovalDtoMapper::toEventResponse)
                .toList();
    }

    private ApprovalInstanceResponse toInstanceResponse(ApprovalInstance instance) {
        List<ApprovalStage> stages = stageRepository.findByApprovalInstanceIdAndTenantIdOrderByStageNoAsc(
                instance.getId(), instance.getTenantId());
        return ApprovalDtoMapper.toInstanceResponse(instance, stages);
    }
}
