package com.procflow.backend.modules.approval.domain;

import java.util.Collection;

/**
 * Decides whether a stage is complete, and with which outcome, from the statuses of its approver tasks.
 *
 * <ul>
 *   <li>{@code ALL}: approved once every task approved; rejected by the first rejection, since approval
 *       can no longer be reached.</li>
 *   <li>{@code ANY}: the first decided task decides.</li>
 *   <li>{@code MAJORITY}: approved once approvals reach {@code n/2 + 1}; rejected once that is out of reach.</li>
 *   <li>{@code QUORUM}: complete once the configured number (or percentage, rounded up) of tasks decided;
 *       approved only when approvals outnumber rejections.</li>
 * </ul>
 * Ties reject. A stage without approver tasks completes as approved.
 */
public final class StageCompletionPolicy {

    private StageCompletionPolicy() {
    }

    public static StageEvaluation evaluate(ApprovalStageMode mode, QuorumType quorumType, Integer quorumValue,
                                           Collection<ApprovalTaskStatus> statuses) {
        int total = statuses.size();
        if (total == 0) {
            return StageEvaluation.approved();
        }
        int approved = (int) statuses.stream().filter(status -> status == ApprovalTaskStatus.APPROVED).count();
        int rejected = (int) statuses.stream().filter(status -> status == ApprovalTaskStatus.REJECTED).count();
        ApprovalStageMode effectiveMode = mode != null ? mode : ApprovalStageMode.ALL;

        return switch (effectiveMode) {
            case ALL -> evaluateAll(total, approved, rejected);
            case ANY -> evaluateAny(approved, rejected);
            case MAJORITY -> evaluateMajority(total, approved, rejected);
            case QUORUM -> evaluateQuorum(total, approved, rejected, quorumType, quorumValue);
        };
    }

    private static StageEvaluation evaluateAll(int total, int approved, int rejected) {
        if (rejected > 0) {
            return StageEvaluation.rejected();
        }
        return approved == total ? StageEvaluation.approved() : StageEvaluation.pending();
    }

    private static StageEvaluation evaluateAny(int approved, int rejected) {
        if (approved > 0) {
            return StageEvaluation.approved();
        }
        return rejected > 0 ? StageEvaluation.rejected() : StageEvaluation.pending();
    }

    private static StageEvaluation evaluateMajority(int total, int approved, int rejected) {
        int required = total / 2 + 1;
        if (approved >= required) {
            return StageEvaluation.approved();
        }
        if (rejected > total - required) {
            return StageEvaluation.rejected();
        }
        return StageEvaluation.pending();
    }

    private static StageEvaluation evaluateQuorum(int total, int approved, int rejected,
                                                  QuorumType quorumType, Integer quorumValue) {
        int decided = approved + rejected;
        if (decided < requiredParticipation(total, quorumType, quorumValue)) {
            return StageEvaluation.pending();
        }
        return approved > rejected ? StageEvaluation.approved() : StageEvaluation.rejected();
    }

    static int requiredParticipation(int total, QuorumType quorumType, Integer quorumValue) {
        if (quorumType == null || quorumValue == null) {
            return total;
        }
        int required = switch (quorumType) {
            case COUNT -> quorumValue;
            case PERCENTAGE -> (int) Math.ceil(quorumValue * total / 100.0);
        };
        return Math.max(1, Math.min(required, total));
    }
}
