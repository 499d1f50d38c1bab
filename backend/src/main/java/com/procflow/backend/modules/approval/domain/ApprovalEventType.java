package com.procflow.backend.modules.approval.domain;

public final class ApprovalEventType {

    public static final String INSTANCE_CREATED = "instance_created";
    public static final String STAGE_ACTIVATED = "stage_activated";
    public static final String TASK_APPROVED = "task_approved";
    public static final String TASK_REJECTED = "task_rejected";
    public static final String STAGE_COMPLETED = "stage_completed";
    public static final String STAGE_REJECTED = "stage_rejected";
    public static final String INSTANCE_COMPLETED = "instance_completed";
    public static final String INSTANCE_REJECTED = "instance_rejected";
    public static final String INSTANCE_CANCELED = "instance_canceled";
    public static final String LIFECYCLE_RESUMED = "lifecycle_resumed";
    public static final String LIFECYCLE_RESUME_FAILED = "lifecycle_resume_failed";
    public static final String SLA_TIMERS_CANCELLED = "sla_timers_cancelled";
    public static final String SLA_REMINDER_SENT = "sla_reminder_sent";
    public static final String SLA_ESCALATION_EXECUTED = "sla_escalation_executed";

    private ApprovalEventType() {
    }

    public static String forDecision(ApprovalDecision decision) {
        return decision == ApprovalDecision.APPROVE ? TASK_APPROVED : TASK_REJECTED;
    }
}
