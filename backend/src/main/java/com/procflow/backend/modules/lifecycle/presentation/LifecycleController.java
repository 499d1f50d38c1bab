package com.procflow.backend.modules.lifecycle.presentation;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.global.error.ProblemException;
import com.procflow.backend.global.web.RequestContextResolver;
import com.procflow.backend.modules.lifecycle.application.LifecycleInstanceService;
import com.procflow.backend.modules.lifecycle.application.LifecycleTransitionService;
import com.procflow.backend.modules.lifecycle.application.TransitionCommand;
import com.procflow.backend.modules.lifecycle.presentation.dto.AvailableTransitionResponse;
import com.procflow.backend.modules.lifecycle.presentation.dto.CreateLifecycleInstanceRequest;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleDtoMapper;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleEventResponse;
import com.procflow.backend.modules.lifecycle.presentation.dto.LifecycleStateResponse;
import com.procflow.backend.modules.lifecycle.presentation.dto.TransitionRequest;
import com.procflow.backend.modules.lifecycle.presentation.dto.TransitionResponse;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/lifecycle/{entityName}/{entityId}")
@Tag(name = "Lifecycle", description = "Entity lifecycle state and transitions")
public class LifecycleController {

    private final LifecycleInstanceService lifecycleInstanceService;
    private final LifecycleTransitionService lifecycleTransitionService;
    private final RequestContextResolver requestContextResolver;

    public LifecycleController(
            LifecycleInstanceService lifecycleInstanceService,
            LifecycleTransitionService lifecycleTransitionService,
            RequestContextResolver requestContextResolver
    ) {
        this.lifecycleInstanceService = lifecycleInstanceService;
        this.lifecycleTransitionService = lifecycleTransitionService;
        this.requestContextResolver = requestContextResolver;
    }

    @PostMapping
    @Operation(summary = "Start the lifecycle of an entity")
    public ResponseEntity<LifecycleStateResponse> createInstance(
            @PathVariable String entityName,
            @PathVariable String entityId,
            @Valid @RequestBody CreateLifecycleInstanceRequest request,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return ResponseEntity.status(201)
                .body(lifecycleInstanceService.createInstance(entityName, entityId, request.lifecycleCode(), ctx));
    }

    @GetMapping
    @Operation(summary = "Current lifecycle state of an entity")
    public ResponseEntity<LifecycleStateResponse> getCurrentState(
            @PathVariable String entityName,
            @PathVariable String entityId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return lifecycleInstanceService.getCurrentState(entityName, entityId, ctx.tenantId())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("LIFECYCLE_INSTANCE_NOT_FOUND",
                        "Lifecycle instance not found for " + entityName + "/" + entityId));
    }

    @GetMapping("/transitions")
    @Operation(summary = "Active transitions leaving the current state")
    public ResponseEntity<List<AvailableTransitionResponse>> getAvailableTransitions(
            @PathVariable String entityName,
            @PathVariable String entityId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return ResponseEntity.ok(
                lifecycleInstanceService.getAvailableTransitions(entityName, entityId, ctx.tenantId()));
    }

    @Operation(
            summary = "Run a transition by operation code",
            description = """
                    Evaluates the transition gates and applies the transition when all pass. \
                    A blocked transition answers 200 with `success=false` and a `reason` such as \
                    `Approval workflow initiated`, `Approval pending` or `Missing required operation: <op>`. \
                    With `dryRun=true` nothing is changed and no approval workflow is started.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Applied, blocked or previewed"),
            @ApiResponse(responseCode = "400", description = "Missing or invalid request context headers")
    })
    @PostMapping("/transition/{operationCode}")
    public ResponseEntity<TransitionResponse> transition(
            @PathVariable String entityName,
            @PathVariable String entityId,
            @PathVariable String operationCode,
            @RequestBody(required = false) TransitionRequest request,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        TransitionCommand command = new TransitionCommand(entityName, entityId, operationCode,
                request != null ? request.record() : null);
        if (request != null && request.isDryRun()) {
            return ResponseEntity.ok(LifecycleDtoMapper.toTransitionResponse(
                    lifecycleTransitionService.canTransition(command, ctx)));
        }
        return ResponseEntity.ok(LifecycleDtoMapper.toTransitionResponse(
                lifecycleTransitionService.transition(command, ctx)));
    }

    @GetMapping("/history")
    @Operation(summary = "Lifecycle events of an entity, newest first")
    public ResponseEntity<List<LifecycleEventResponse>> getHistory(
            @PathVariable String entityName,
            @PathVariable String entityId,
            HttpServletRequest httpRequest
    ) {
        RequestContext ctx = requestContextResolver.resolve(httpRequest);
        return ResponseEntity.ok(lifecycleInstanceService.getHistory(entityName, entityId, ctx.tenantId()));
    }
}
