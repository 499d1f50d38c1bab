package com.procflow.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.procflow.backend.global.common.transaction.AfterCommit;
import com.procflow.backend.modules.audit.domain.AuditLog;
import com.procflow.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fire-and-forget business audit trail.
 * Inside a transaction the row is written after commit, so rolled-back work leaves no audit entry.
 * Write failures are logged and never reach the caller.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate requiresNew;

    public AuditLogService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.tenantId(), "tenantId is required");
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AfterCommit.run(() -> write(command));
    }

    private void write(AuditLogCommand command) {
        try {
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(toEntity(command)));
        } catch (RuntimeException ex) {
            log.warn("audit_log_write_failed action={} resource={}:{}",
                    command.actionType(), command.resourceType(), command.resourceKey(), ex);
        }
    }

    private AuditLog toEntity(AuditLogCommand command) {
        AuditLog auditLog = new AuditLog();
        auditLog.setTenantId(command.tenantId());
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorId(command.actorId());
        auditLog.setCorrelationId(command.correlationId());
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }
        return auditLog;
    }

    public record AuditLogCommand(
            UUID tenantId,
            String actionType,
            String resourceType,
            String resourceKey,
            String actorId,
            UUID correlationId,
            Map<String, Object> detail
    ) {
    }
}
