package com.procflow.backend.modules.approval.presentation;

import java.util.List;
import java.util.UUID;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.global.error.ProblemException;
import com.procflow.backend.global.web.RequestContextResolver;
import com.procflow.backend.modules.approval.application.ApprovalDecisionCommand;
import com.procflow.backend.modules.approval.application.ApprovalDecisionService;
import com.procflow.backend.modules.approval.application.ApprovalInstanceService;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalDecisionRequest;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalDecisionResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalDtoMapper;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalEventResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalInstanceResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalTaskListResponse;
import com.procflow.backend.modules.approval.presentation.dto.ApprovalTaskResponse;
import com.procflow.backend.modules.approval.presentation.dto.AssignmentSnapshotResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/approvals")
@Tag(name = "Approval", description = "Approval workflows, tasks and decisions")
public class ApprovalController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ApprovalInstanceService approvalInstanceService;
    private final ApprovalDecisionService approvalDecisionService;
    private final RequestContextResolver requestContextResolver;

    public ApprovalController(
            ApprovalInstanceService approvalInstanceService,
            ApprovalDecisionService approvalDecisionService,
            RequestContextResolver requestContextResolver
    ) {
        this.approvalInstanceService = approvalInstanceService;
        this.approvalDecisionService = approvalDecisionService;
        this.requestContextResolver = requestContextResolver;
    }

    @GetMapping("/instances/{instanceId}")
    @Operation(summary = "Approval instance with its stages")
    public ResponseEntity<ApprovalInstanceResponse> getInstance(
            @PathVariable UUID instanceId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return approvalInstanceService.getInstance(instanceId, ctx.tenantId())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> instanceNotFound(instanceId));
    }

    @GetMapping("/entities/{entityName}/{entityId}")
    @Operation(summary = "Open approval instance of an entity")
    public ResponseEntity<ApprovalInstanceResponse> getInstanceForEntity(
            @PathVariable String entityName,
            @PathVariable String entityId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return approvalInstanceService.getInstanceForEntity(entityName, entityId, ctx.tenantId())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("APPROVAL_INSTANCE_NOT_FOUND",
                        "No open approval instance for " + entityName + "/" + entityId));
    }

    @GetMapping("/instances/{instanceId}/tasks")
    @Operation(summary = "Tasks of an approval instance")
    public ResponseEntity<List<ApprovalTaskResponse>> getTasksForInstance(
            @PathVariable UUID instanceId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return ResponseEntity.ok(approvalInstanceService.getTasksForInstance(instanceId, ctx.tenantId()));
    }

    @GetMapping("/instances/{instanceId}/events")
    @Operation(summary = "Event log of an approval instance, oldest first")
    public ResponseEntity<List<ApprovalEventResponse>> getEvents(
            @PathVariable UUID instanceId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return ResponseEntity.ok(approvalInstanceService.getEvents(instanceId, ctx.tenantId()));
    }

    @GetMapping("/instances/{instanceId}/stages/{stageNo}/assignment")
    @Operation(summary = "Approvers resolved when a stage was activated")
    public ResponseEntity<AssignmentSnapshotResponse> getAssignmentSnapshot(
            @PathVariable UUID instanceId,
            @PathVariable int stageNo,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return approvalInstanceService.getAssignmentSnapshot(instanceId, stageNo, ctx.tenantId())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("ASSIGNMENT_SNAPSHOT_NOT_FOUND",
                        "No assignment snapshot for stage " + stageNo + " of " + instanceId));
    }

    @GetMapping("/tasks/mine")
    @Operation(summary = "Pending tasks assigned to the caller")
    public ResponseEntity<ApprovalTaskListResponse> getMyTasks(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(
                approvalInstanceService.getTasksForUser(ctx.userId(), ctx.tenantId(), safePage, safeSize));
    }

    @GetMapping("/tasks/{taskId}")
    @Operation(summary = "Single approval task")
    public ResponseEntity<ApprovalTaskResponse> getTask(
            @PathVariable UUID taskId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return approvalInstanceService.getTask(taskId, ctx.tenantId())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("APPROVAL_TASK_NOT_FOUND",
                        "Approval task not found: " + taskId));
    }

    @Operation(
            summary = "Approve or reject a task",
            description = """
                    Records the decision and re-evaluates the stage. When the last stage completes, the \
                    lifecycle transition that started the workflow is applied. Validation failures such as \
                    `Task not found` or `Task not pending` answer 200 with `success=false`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision recorded or refused"),
            @ApiResponse(responseCode = "422", description = "Missing decision")
    })
    @PostMapping("/tasks/{taskId}/decision")
    public ResponseEntity<ApprovalDecisionResponse> decide(
            @PathVariable UUID taskId,
            @Valid @RequestBody ApprovalDecisionRequest request,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        ApprovalDecisionCommand command = new ApprovalDecisionCommand(taskId, request.decision(), request.note());
        return ResponseEntity.ok(ApprovalDtoMapper.toDecisionResponse(
                approvalDecisionService.makeDecision(command, ctx)));
    }

    private static ProblemException instanceNotFound(UUID instanceId) {
        return ProblemException.notFound("APPROVAL_INSTANCE_NOT_FOUND", "Approval instance not found: " + instanceId);
    }
}
