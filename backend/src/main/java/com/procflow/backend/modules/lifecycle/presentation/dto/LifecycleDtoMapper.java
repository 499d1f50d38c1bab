package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.util.UUID;

import com.procflow.backend.modules.lifecycle.application.GateDecision;
import com.procflow.backend.modules.lifecycle.application.TransitionResult;
import com.procflow.backend.modules.lifecycle.domain.LifecycleEvent;
import com.procflow.backend.modules.lifecycle.domain.LifecycleInstance;
import com.procflow.backend.modules.lifecycle.domain.LifecycleState;
import com.procflow.backend.modules.lifecycle.domain.LifecycleTransition;

public final class LifecycleDtoMapper {

    private LifecycleDtoMapper() {
    }

    public static LifecycleStateResponse toStateResponse(LifecycleInstance instance) {
        LifecycleState state = instance.getCurrentState();
        return new LifecycleStateResponse(
                instance.getId(),
                instance.getEntityName(),
                instance.getEntityId(),
                instance.getLifecycle().getCode(),
                state.getId(),
                state.getCode(),
                state.getName(),
                state.isTerminal(),
                instance.getUpdatedBy(),
                instance.getUpdatedAt()
        );
    }

    public static AvailableTransitionResponse toAvailableTransition(LifecycleTransition transition,
                                                                    UUID approvalTemplateId) {
        return new AvailableTransitionResponse(
                transition.getId(),
                transition.getOperationCode(),
                transition.getName(),
                transition.getToState().getCode(),
                transition.getToState().getName(),
                approvalTemplateId != null,
                approvalTemplateId
        );
    }

    public static LifecycleEventResponse toEventResponse(LifecycleEvent event) {
        return new LifecycleEventResponse(
                event.getId(),
                event.getEventType(),
                event.getTransitionId(),
                event.getOperationCode(),
                event.getFromStateCode(),
                event.getToStateCode(),
                event.getActorId(),
                event.getPayload(),
                event.getOccurredAt()
        );
    }

    public static TransitionResponse toTransitionResponse(TransitionResult result) {
        return new TransitionResponse(
                result.success(),
                result.fromStateCode(),
                result.toStateCode(),
                result.eventId(),
                result.reason()
        );
    }

    public static TransitionResponse toTransitionResponse(GateDecision preview) {
        return new TransitionResponse(preview.allowed(), null, null, null, preview.reason());
    }
}
