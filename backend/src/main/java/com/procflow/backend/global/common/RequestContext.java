package com.procflow.backend.global.common;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity and tenant scope carried through every lifecycle and approval operation.
 * {@code metadata} is internal only: it is never populated from an inbound request.
 */
public record RequestContext(
        String userId,
        UUID tenantId,
        String realmId,
        List<String> roles,
        Map<String, Object> metadata
) {

    public static final String APPROVAL_BYPASS = "_approvalBypass";
    public static final String APPROVAL_INSTANCE_ID = "_approvalInstanceId";
    public static final String DEFAULT_REALM = "default";
    public static final String SYSTEM_ROLE = "system";

    public RequestContext {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(tenantId, "tenantId is required");
        realmId = realmId != null ? realmId : DEFAULT_REALM;
        roles = roles != null ? List.copyOf(roles) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static RequestContext of(String userId, UUID tenantId, List<String> roles) {
        return new RequestContext(userId, tenantId, DEFAULT_REALM, roles, Map.of());
    }

    /**
     * Context used when the approval engine replays a transition it previously blocked.
     */
    public static RequestContext system(String actor, UUID tenantId, UUID approvalInstanceId) {
        return new RequestContext(
                actor,
                tenantId,
                SYSTEM_ROLE,
                List.of(SYSTEM_ROLE),
                Map.of(APPROVAL_BYPASS, Boolean.TRUE, APPROVAL_INSTANCE_ID, approvalInstanceId.toString())
        );
    }

    public boolean approvalBypass() {
        return Boolean.TRUE.equals(metadata.get(APPROVAL_BYPASS));
    }

    public boolean hasRole(String role) {
        return roles.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(role));
    }
}
