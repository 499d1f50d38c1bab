package com.procflow.backend.modules.approval.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ApprovalStatusMapperTest {

    @Test
    @DisplayName("canceled rows are reported by their context reason when no outcome is stored")
    void canceledRowsWithoutOutcome() {
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.CANCELED, null,
                Map.of("reason", "rejected"))).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.CANCELED, null,
                Map.of("reason", "timeout"))).isEqualTo(ApprovalStatus.CANCELED);
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.CANCELED, null, null))
                .isEqualTo(ApprovalStatus.CANCELED);
    }

    @Test
    @DisplayName("open and completed map one to one")
    void openAndCompleted() {
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.OPEN, null, null))
                .isEqualTo(ApprovalStatus.OPEN);
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.COMPLETED, null, Map.of()))
                .isEqualTo(ApprovalStatus.COMPLETED);
    }

    @Test
    @DisplayName("the stored outcome wins over the context reason")
    void outcomeWins() {
        ApprovalInstance rejected = new ApprovalInstance();
        rejected.reject(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        ApprovalInstance canceled = new ApprovalInstance();
        canceled.cancel(ApprovalInstance.REASON_NO_APPROVERS, OffsetDateTime.parse("2025-01-01T00:00:00Z"));

        assertThat(rejected.getStatus()).isEqualTo(ApprovalInstanceStatus.CANCELED);
        assertThat(rejected.getContext()).containsEntry("reason", "rejected");
        assertThat(ApprovalStatusMapper.toExternalStatus(rejected)).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(ApprovalStatusMapper.toExternalStatus(canceled)).isEqualTo(ApprovalStatus.CANCELED);
        assertThat(ApprovalStatusMapper.toExternalStatus(ApprovalInstanceStatus.CANCELED, ApprovalStatus.CANCELED,
                Map.of("reason", "rejected"))).isEqualTo(ApprovalStatus.CANCELED);
    }
}
