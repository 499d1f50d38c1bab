package com.procflow.backend.modules.lifecycle.application;

import static com.procflow.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGatePort;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGateStatus;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartCommand;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartResult;
import com.procflow.backend.modules.lifecycle.domain.LifecycleTransitionGate;
import com.procflow.backend.modules.lifecycle.infrastructure.persistence.LifecycleTransitionGateRepository;
import com.procflow.backend.modules.policy.application.PolicyGate;
import com.procflow.backend.modules.policy.domain.PolicyDecision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransitionGateEvaluatorTest {

    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID TRANSITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000123");
    private static final UUID TEMPLATE_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final EntityContext ENTITY = new EntityContext("travel_request", "tr-1");

    @Mock
    private LifecycleTransitionGateRepository gateRepository;

    @Mock
    private PolicyGate policyGate;

    @Mock
    private ApprovalGatePort approvalGatePort;

    private TransitionGateEvaluator evaluator;
    private RequestContext ctx;

    @BeforeEach
    void setUp() {
        evaluator = new TransitionGateEvaluator(gateRepository, policyGate, approvalGatePort);
        ctx = RequestContext.of("alice", TENANT, List.of("EMPLOYEE"));
    }

    private static LifecycleTransitionGate gate(List<String> requiredOperations, UUID approvalTemplateId) {
        LifecycleTransitionGate gate = withId(new LifecycleTransitionGate(), UUID.randomUUID());
        gate.setTenantId(TENANT);
        gate.setTransitionId(TRANSITION_ID);
        gate.setRequiredOperations(requiredOperations);
        gate.setApprovalTemplateId(approvalTemplateId);
        return gate;
    }

    private void givenGates(LifecycleTransitionGate... gates) {
        when(gateRepository.findGatesInEvaluationOrder(TENANT, TRANSITION_ID)).thenReturn(List.of(gates));
    }

    @Test
    @DisplayName("a transition without gates is allowed")
    void noGatesAllows() {
        givenGates();

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY);

        assertThat(decision).isEqualTo(GateDecision.allow());
        verifyNoInteractions(policyGate, approvalGatePort);
    }

    @Test
    @DisplayName("no open instance: an approval workflow is started and the transition blocked")
    void startsApprovalWhenNoneExists() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1")).thenReturn(Optional.empty());
        UUID instanceId = UUID.randomUUID();
        when(approvalGatePort.startApproval(any(ApprovalStartCommand.class), eq(ctx)))
                .thenReturn(ApprovalStartResult.started(instanceId, 2, 3));

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, ctx, Map.of("amount", 900), ENTITY);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("Approval workflow initiated");
        ArgumentCaptor<ApprovalStartCommand> command = ArgumentCaptor.forClass(ApprovalStartCommand.class);
        verify(approvalGatePort).startApproval(command.capture(), eq(ctx));
        assertThat(command.getValue().transitionId()).isEqualTo(TRANSITION_ID);
        assertThat(command.getValue().approvalTemplateId()).isEqualTo(TEMPLATE_ID);
        assertThat(command.getValue().record()).containsEntry("amount", 900);
    }

    @Test
    @DisplayName("an open instance blocks with approval pending and starts nothing")
    void openInstanceBlocks() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1"))
                .thenReturn(Optional.of(ApprovalGateStatus.OPEN));

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY);

        assertThat(decision).isEqualTo(GateDecision.block("Approval pending"));
        verify(approvalGatePort, never()).startApproval(any(), any());
    }

    @Test
    @DisplayName("a completed approval satisfies the gate")
    void completedApprovalAllows() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1"))
                .thenReturn(Optional.of(ApprovalGateStatus.COMPLETED));

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isNull();
    }

    @Test
    @DisplayName("a rejected or canceled approval blocks as canceled")
    void rejectedApprovalBlocks() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1"))
                .thenReturn(Optional.of(ApprovalGateStatus.REJECTED));

        assertThat(evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY))
                .isEqualTo(GateDecision.block("Approval was canceled"));
    }

    @Test
    @DisplayName("a failed creation blocks with the creation error")
    void failedCreationBlocks() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1")).thenReturn(Optional.empty());
        when(approvalGatePort.startApproval(any(), any())).thenReturn(ApprovalStartResult.failed("Template not found"));

        assertThat(evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY))
                .isEqualTo(GateDecision.block("Failed to create approval: Template not found"));
    }

    @Test
    @DisplayName("a permission denial short-circuits before the approval engine is consulted")
    void permissionDenialShortCircuits() {
        givenGates(gate(List.of("travel.approve"), TEMPLATE_ID), gate(null, TEMPLATE_ID));
        when(policyGate.authorize(eq("travel.approve"), eq("travel_request"), eq(ctx), any()))
                .thenReturn(PolicyDecision.deny("Role grants do not include travel.approve"));

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), ENTITY);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason())
                .startsWith("Missing required operation: travel.approve")
                .contains("Role grants do not include travel.approve");
        verifyNoInteractions(approvalGatePort);
    }

    @Test
    @DisplayName("the bypass flag skips the approval branch even with a template configured")
    void bypassSkipsApproval() {
        givenGates(gate(List.of("travel.approve"), TEMPLATE_ID));
        when(policyGate.authorize(anyString(), anyString(), any(), any())).thenReturn(PolicyDecision.allow());
        RequestContext resume = RequestContext.system("system", TENANT, UUID.randomUUID());

        GateDecision decision = evaluator.validateGates(TRANSITION_ID, resume, Map.of(), ENTITY);

        assertThat(decision.allowed()).isTrue();
        verifyNoInteractions(approvalGatePort);
    }

    @Test
    @DisplayName("without an entity context the approval part of a gate counts as satisfied")
    void missingEntityContextSkipsApproval() {
        givenGates(gate(null, TEMPLATE_ID));

        assertThat(evaluator.validateGates(TRANSITION_ID, ctx, Map.of(), null).allowed()).isTrue();
        verifyNoInteractions(approvalGatePort);
    }

    @Test
    @DisplayName("gates whose conditions do not match are skipped")
    void nonMatchingConditionsSkipGate() {
        LifecycleTransitionGate highValue = gate(null, TEMPLATE_ID);
        highValue.setConditions(Map.of("field", "amount", "operator", "gte", "value", 1000));
        givenGates(highValue);

        assertThat(evaluator.validateGates(TRANSITION_ID, ctx, Map.of("amount", 200), ENTITY).allowed()).isTrue();
        verifyNoInteractions(approvalGatePort);
    }

    @Test
    @DisplayName("preview reports a needed approval without starting one")
    void previewDoesNotStartApproval() {
        givenGates(gate(null, TEMPLATE_ID));
        when(approvalGatePort.findOpenApprovalStatus(TENANT, "travel_request", "tr-1")).thenReturn(Optional.empty());

        assertThat(evaluator.previewGates(TRANSITION_ID, ctx, Map.of(), ENTITY))
                .isEqualTo(GateDecision.block("Approval required"));
        verify(approvalGatePort, never()).startApproval(any(), any());
    }

    @Test
    @DisplayName("requiresApproval returns the first configured template")
    void requiresApprovalReturnsTemplate() {
        givenGates(gate(List.of("travel.submit"), null), gate(null, TEMPLATE_ID));

        assertThat(evaluator.requiresApproval(TRANSITION_ID, TENANT)).contains(TEMPLATE_ID);
    }
}
