package com.procflow.backend.modules.lifecycle.application.port;

import java.util.Map;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.lifecycle.application.TransitionResult;

/**
 * What the approval engine needs from the lifecycle: replay a transition it had blocked.
 */
public interface TransitionResumer {

    TransitionResult resumeTransition(UUID transitionId, String entityName, String entityId,
                                      Map<String, Object> record, RequestContext ctx);
}
