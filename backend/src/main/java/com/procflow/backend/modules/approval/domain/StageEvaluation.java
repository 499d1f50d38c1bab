package com.procflow.backend.modules.approval.domain;

public record StageEvaluation(boolean complete, StageOutcome outcome) {

    public static StageEvaluation pending() {
        return new StageEvaluation(false, null);
    }

    public static StageEvaluation approved() {
        return new StageEvaluation(true, StageOutcome.COMPLETED);
    }

    public static StageEvaluation rejected() {
        return new StageEvaluation(true, StageOutcome.REJECTED);
    }
}
