package com.procflow.backend.modules.condition.application;

import java.util.HashMap;
import java.util.Map;

import com.procflow.backend.global.common.RequestContext;

/**
 * Builds the map that gate and routing-rule conditions are matched against: the entity record
 * plus the caller fields, which always take precedence over same-named record keys.
 */
public final class EvaluationContexts {

    private EvaluationContexts() {
    }

    public static Map<String, Object> of(Map<String, Object> record, RequestContext ctx,
                                         String entityName, String entityId) {
        Map<String, Object> context = new HashMap<>();
        if (record != null) {
            context.putAll(record);
        }
        context.put("userId", ctx.userId());
        context.put("requesterId", ctx.userId());
        context.put("tenantId", ctx.tenantId().toString());
        context.put("realmId", ctx.realmId());
        context.put("roles", ctx.roles());
        if (entityName != null) {
            context.put("entityName", entityName);
        }
        if (entityId != null) {
            context.put("entityId", entityId);
        }
        return context;
    }
}
