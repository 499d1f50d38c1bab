package com.procflow.backend.modules.approval.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.procflow.backend.modules.approval.domain.ApprovalRoutingRule;
import com.procflow.backend.modules.condition.application.ConditionEvaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the approvers of a stage from the template's routing rules.
 *
 * <p>Rules are expected in priority order. The first primary rule that applies to the stage, matches the
 * evaluation context and yields at least one assignee wins. Fallback rules are searched the same way only
 * when no primary rule produced anyone.</p>
 *
 * <p>{@code assign_to} shapes: {@code {"principal_id": "u1"}}, {@code {"group_id": "g1"}} and
 * {@code {"assignees": ["u1", {"group_id": "g1"}]}}. Only the {@code direct} strategy is supported;
 * any other strategy is read as direct.</p>
 */
@Component
public class ApproverResolver {

    private static final Logger log = LoggerFactory.getLogger(ApproverResolver.class);

    static final String STRATEGY_DIRECT = "direct";

    public List<ResolvedAssignee> resolve(List<ApprovalRoutingRule> rules, int stageNo,
                                          Map<String, Object> evaluationContext) {
        List<ResolvedAssignee> primary = search(rules, stageNo, evaluationContext, false);
        if (!primary.isEmpty()) {
            return primary;
        }
        return search(rules, stageNo, evaluationContext, true);
    }

    private List<ResolvedAssignee> search(List<ApprovalRoutingRule> rules, int stageNo,
                                          Map<String, Object> evaluationContext, boolean fallback) {
        for (ApprovalRoutingRule rule : rules) {
            if (rule.isFallback() != fallback || !rule.appliesToStage(stageNo)) {
                continue;
            }
            if (!ConditionEvaluator.matches(rule.getConditions(), evaluationContext)) {
                continue;
            }
            List<ResolvedAssignee> assignees = assigneesOf(rule);
            if (!assignees.isEmpty()) {
                log.debug("approver_rule_matched rule={} stage={} fallback={} assignees={}",
                        rule.getId(), stageNo, fallback, assignees.size());
                return assignees;
            }
        }
        return List.of();
    }

    List<ResolvedAssignee> assigneesOf(ApprovalRoutingRule rule) {
        Map<String, Object> assignTo = rule.getAssignTo();
        if (assignTo == null || assignTo.isEmpty()) {
            return List.of();
        }
        Object strategy = assignTo.get("strategy");
        if (strategy != null && !STRATEGY_DIRECT.equalsIgnoreCase(strategy.toString())) {
            log.debug("approver_strategy_unsupported rule={} strategy={} treated_as=direct", rule.getId(), strategy);
        }

        Set<ResolvedAssignee> resolved = new LinkedHashSet<>();
        if (assignTo.get("assignees") instanceof Collection<?> assignees) {
            for (Object assignee : assignees) {
                addAssignee(resolved, assignee, rule);
            }
        } else {
            addAssignee(resolved, assignTo, rule);
        }
        return new ArrayList<>(resolved);
    }

    private static void addAssignee(Set<ResolvedAssignee> resolved, Object assignee, ApprovalRoutingRule rule) {
        if (assignee instanceof String principalId) {
            if (!principalId.isBlank()) {
                resolved.add(ResolvedAssignee.principal(principalId, rule.getId()));
            }
            return;
        }
        if (!(assignee instanceof Map<?, ?> target)) {
            return;
        }
        String principalId = text(target.get("principal_id"));
        if (principalId != null) {
            resolved.add(ResolvedAssignee.principal(principalId, rule.getId()));
            return;
        }
        String groupId = text(target.get("group_id"));
        if (groupId != null) {
            resolved.add(ResolvedAssignee.group(groupId, rule.getId()));
        }
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
