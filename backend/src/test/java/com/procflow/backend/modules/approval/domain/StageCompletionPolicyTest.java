package com.procflow.backend.modules.approval.domain;

import static com.procflow.backend.modules.approval.domain.ApprovalTaskStatus.APPROVED;
import static com.procflow.backend.modules.approval.domain.ApprovalTaskStatus.PENDING;
import static com.procflow.backend.modules.approval.domain.ApprovalTaskStatus.REJECTED;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StageCompletionPolicyTest {

    @Test
    @DisplayName("all: pending until every task approved, rejected by the first rejection")
    void allMode() {
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ALL, null, null, List.of(APPROVED, PENDING)))
                .isEqualTo(StageEvaluation.pending());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ALL, null, null, List.of(APPROVED, APPROVED)))
                .isEqualTo(StageEvaluation.approved());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ALL, null, null, List.of(REJECTED, PENDING)))
                .isEqualTo(StageEvaluation.rejected());
    }

    @Test
    @DisplayName("any: the first decision decides")
    void anyMode() {
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ANY, null, null, List.of(PENDING, PENDING)))
                .isEqualTo(StageEvaluation.pending());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ANY, null, null, List.of(PENDING, APPROVED)))
                .isEqualTo(StageEvaluation.approved());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ANY, null, null, List.of(REJECTED, PENDING)))
                .isEqualTo(StageEvaluation.rejected());
    }

    @Test
    @DisplayName("majority: approved at n/2+1, rejected once the majority is out of reach")
    void majorityMode() {
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.MAJORITY, null, null,
                List.of(APPROVED, APPROVED, PENDING))).isEqualTo(StageEvaluation.approved());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.MAJORITY, null, null,
                List.of(APPROVED, REJECTED, PENDING))).isEqualTo(StageEvaluation.pending());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.MAJORITY, null, null,
                List.of(REJECTED, REJECTED, PENDING))).isEqualTo(StageEvaluation.rejected());
        // 2 of 4 is not a majority and 3 can no longer be reached
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.MAJORITY, null, null,
                List.of(APPROVED, APPROVED, REJECTED, REJECTED))).isEqualTo(StageEvaluation.rejected());
    }

    @Test
    @DisplayName("quorum: completes once enough decided, ties reject")
    void quorumMode() {
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.QUORUM, QuorumType.COUNT, 2,
                List.of(APPROVED, PENDING, PENDING))).isEqualTo(StageEvaluation.pending());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.QUORUM, QuorumType.COUNT, 2,
                List.of(APPROVED, APPROVED, PENDING))).isEqualTo(StageEvaluation.approved());
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.QUORUM, QuorumType.COUNT, 2,
                List.of(APPROVED, REJECTED, PENDING))).isEqualTo(StageEvaluation.rejected());
    }

    @Test
    @DisplayName("quorum participation is clamped and percentages round up")
    void quorumParticipation() {
        assertThat(StageCompletionPolicy.requiredParticipation(3, QuorumType.PERCENTAGE, 50)).isEqualTo(2);
        assertThat(StageCompletionPolicy.requiredParticipation(3, QuorumType.COUNT, 10)).isEqualTo(3);
        assertThat(StageCompletionPolicy.requiredParticipation(3, QuorumType.COUNT, 0)).isEqualTo(1);
        assertThat(StageCompletionPolicy.requiredParticipation(4, null, null)).isEqualTo(4);
    }

    @Test
    @DisplayName("a stage without approver tasks completes as approved")
    void emptyStage() {
        assertThat(StageCompletionPolicy.evaluate(ApprovalStageMode.ALL, null, null, List.of()))
                .isEqualTo(StageEvaluation.approved());
    }
}
