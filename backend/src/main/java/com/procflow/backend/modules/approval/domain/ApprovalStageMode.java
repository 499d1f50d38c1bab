package com.procflow.backend.modules.approval.domain;

/**
 * How the approver tasks of one stage combine into a stage outcome.
 */
public enum ApprovalStageMode {
    /** Every approver must approve; the first rejection rejects the stage. */
    ALL,
    /** The first decision decides the stage. */
    ANY,
    /** More than half of the approvers decide. */
    MAJORITY,
    /** A configured number or percentage of decisions must be in, then approvals must outnumber rejections. */
    QUORUM
}
