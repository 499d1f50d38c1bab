package com.procflow.backend.modules.policy.application;

import java.util.Map;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.policy.domain.PolicyDecision;

/**
 * Authorizes a single operation code for the caller. Deployments may replace the default role-based bean.
 */
public interface PolicyGate {

    PolicyDecision authorize(String operationCode, String entityName, RequestContext ctx, Map<String, Object> record);
}
