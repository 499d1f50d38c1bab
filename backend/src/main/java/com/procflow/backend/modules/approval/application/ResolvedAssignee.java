package com.procflow.backend.modules.approval.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One approver produced by a routing rule: a principal or a group, never both.
 */
public record ResolvedAssignee(String principalId, String groupId, UUID ruleId) {

    public static ResolvedAssignee principal(String principalId, UUID ruleId) {
        return new ResolvedAssignee(principalId, null, ruleId);
    }

    public static ResolvedAssignee group(String groupId, UUID ruleId) {
        return new ResolvedAssignee(null, groupId, ruleId);
    }

    public Map<String, Object> toSnapshotEntry() {
        Map<String, Object> entry = new LinkedHashMap<>();
        if (principalId != null) {
            entry.put("principalId", principalId);
        }
        if (groupId != null) {
            entry.put("groupId", groupId);
        }
        if (ruleId != null) {
            entry.put("ruleId", ruleId.toString());
        }
        return entry;
    }
}
