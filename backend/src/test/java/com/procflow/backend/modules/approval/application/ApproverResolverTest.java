package com.procflow.backend.modules.approval.application;

import static com.procflow.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalRoutingRule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ApproverResolverTest {

    private final ApproverResolver resolver = new ApproverResolver();

    private static ApprovalRoutingRule rule(Integer stageNo, boolean fallback, Map<String, Object> conditions,
                                            Map<String, Object> assignTo) {
        ApprovalRoutingRule rule = withId(new ApprovalRoutingRule(), UUID.randomUUID());
        rule.setStageNo(stageNo);
        rule.setFallback(fallback);
        rule.setConditions(conditions);
        rule.setAssignTo(assignTo);
        return rule;
    }

    @Test
    @DisplayName("the first matching primary rule wins")
    void firstMatchingPrimaryRuleWins() {
        ApprovalRoutingRule highAmount = rule(1, false,
                Map.of("field", "amount", "operator", "gt", "value", 1000),
                Map.of("principal_id", "cfo"));
        ApprovalRoutingRule anyAmount = rule(1, false, null, Map.of("principal_id", "manager"));

        List<ResolvedAssignee> assignees = resolver.resolve(List.of(highAmount, anyAmount), 1, Map.of("amount", 5000));

        assertThat(assignees).containsExactly(ResolvedAssignee.principal("cfo", highAmount.getId()));
    }

    @Test
    @DisplayName("non-matching and other-stage rules are skipped")
    void skipsRulesThatDoNotApply() {
        ApprovalRoutingRule highAmount = rule(1, false,
                Map.of("field", "amount", "operator", "gt", "value", 1000),
                Map.of("principal_id", "cfo"));
        ApprovalRoutingRule secondStage = rule(2, false, null, Map.of("principal_id", "director"));
        ApprovalRoutingRule allStages = rule(null, false, null, Map.of("group_id", "finance-team"));

        List<ResolvedAssignee> assignees = resolver.resolve(List.of(highAmount, secondStage, allStages), 1,
                Map.of("amount", 50));

        assertThat(assignees).containsExactly(ResolvedAssignee.group("finance-team", allStages.getId()));
    }

    @Test
    @DisplayName("fallback rules apply only when no primary rule yields assignees")
    void fallbackOnlyWhenNoPrimaryMatches() {
        ApprovalRoutingRule fallback = rule(null, true, null, Map.of("principal_id", "admin"));
        ApprovalRoutingRule primary = rule(null, false,
                Map.of("field", "department", "operator", "eq", "value", "sales"),
                Map.of("principal_id", "sales-lead"));

        assertThat(resolver.resolve(List.of(fallback, primary), 1, Map.of("department", "sales")))
                .extracting(ResolvedAssignee::principalId)
                .containsExactly("sales-lead");
        assertThat(resolver.resolve(List.of(fallback, primary), 1, Map.of("department", "hr")))
                .extracting(ResolvedAssignee::principalId)
                .containsExactly("admin");
    }

    @Test
    @DisplayName("assignee lists mix principals and groups and drop duplicates")
    void assigneeLists() {
        ApprovalRoutingRule rule = rule(null, false, null, Map.of(
                "strategy", "direct",
                "assignees", List.of("alice", Map.of("principal_id", "bob"), Map.of("group_id", "auditors"), "alice")));

        assertThat(resolver.resolve(List.of(rule), 1, Map.of())).containsExactly(
                ResolvedAssignee.principal("alice", rule.getId()),
                ResolvedAssignee.principal("bob", rule.getId()),
                ResolvedAssignee.group("auditors", rule.getId()));
    }

    @Test
    @DisplayName("unsupported strategies are read as direct assignment")
    void unsupportedStrategyFallsBackToDirect() {
        ApprovalRoutingRule rule = rule(null, false, null, Map.of("strategy", "hierarchy", "principal_id", "carol"));

        assertThat(resolver.resolve(List.of(rule), 1, Map.of()))
                .extracting(ResolvedAssignee::principalId)
                .containsExactly("carol");
    }

    @Test
    @DisplayName("a rule without assignees does not stop the search")
    void emptyRuleIsSkipped() {
        ApprovalRoutingRule empty = rule(null, false, null, Map.of("assignees", List.of()));
        ApprovalRoutingRule next = rule(null, false, null, Map.of("principal_id", "dave"));

        assertThat(resolver.resolve(List.of(empty, next), 1, Map.of()))
                .extracting(ResolvedAssignee::principalId)
                .containsExactly("dave");
        assertThat(resolver.resolve(List.of(empty), 1, Map.of())).isEmpty();
    }
}
