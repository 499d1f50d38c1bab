package com.procflow.backend.modules.policy.application;

import java.util.List;
import java.util.Map;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.policy.domain.PolicyDecision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grants an operation when one of the caller's roles lists it under {@code procflow.policy.role-operations}
 * or the caller holds a super-role. Register a {@code @Primary} {@link PolicyGate} to replace it.
 */
@Component
public class RolePolicyGate implements PolicyGate {

    private static final Logger log = LoggerFactory.getLogger(RolePolicyGate.class);

    private final PolicyProperties properties;

    public RolePolicyGate(PolicyProperties properties) {
        this.properties = properties;
    }

    @Override
    public PolicyDecision authorize(String operationCode, String entityName, RequestContext ctx,
                                    Map<String, Object> record) {
        // Replay of a transition whose approval completed; the requester was checked when it was first requested.
        if (ctx.approvalBypass() && ctx.hasRole(RequestContext.SYSTEM_ROLE)) {
            return PolicyDecision.allow();
        }
        if (properties.superRoles().stream().anyMatch(ctx::hasRole)) {
            return PolicyDecision.allow();
        }
        for (String role : ctx.roles()) {
            List<String> operations = grantsFor(role);
            if (operations.stream().anyMatch(operation -> operation.equalsIgnoreCase(operationCode))) {
                return PolicyDecision.allow();
            }
        }
        log.debug("policy_denied operation={} entity={} user={}", operationCode, entityName, ctx.userId());
        return PolicyDecision.deny("Role grants do not include " + operationCode);
    }

    private List<String> grantsFor(String role) {
        return properties.roleOperations().entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(role))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(List.of());
    }
}
