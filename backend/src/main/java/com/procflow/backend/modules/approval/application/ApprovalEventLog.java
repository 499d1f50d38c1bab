package com.procflow.backend.modules.approval.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalEvent;
import com.procflow.backend.modules.approval.infrastructure.persistence.ApprovalEventRepository;

import org.springframework.stereotype.Component;

/**
 * Appends rows to the approval event log in the caller's transaction.
 */
@Component
public class ApprovalEventLog {

    private final ApprovalEventRepository eventRepository;
    private final Clock clock;

    public ApprovalEventLog(ApprovalEventRepository eventRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    public ApprovalEvent append(UUID tenantId, UUID instanceId, UUID taskId, String eventType,
                                Map<String, Object> payload, String actorId) {
        ApprovalEvent event = new ApprovalEvent();
        event.setTenantId(tenantId);
        event.setApprovalInstanceId(instanceId);
        event.setApprovalTaskId(taskId);
        event.setEventType(eventType);
        event.setPayload(payload != null ? new HashMap<>(payload) : Map.of());
        event.setActorId(actorId);
        event.setOccurredAt(OffsetDateTime.now(clock));
        return eventRepository.save(event);
    }
}
