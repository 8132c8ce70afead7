package com.casetrace.repair;

public enum RepairOutcome {
    APPLIED,
    /**
     * Dry run: the action was planned and logged only.
     */
    WOULD_APPLY,
    /**
     * A worker changed the row after it was read, so the guarded write matched nothing.
     */
    SKIPPED_CONCURRENT_CHANGE,
    /**
     * The batch transaction failed and this write was rolled back.
     */
    ROLLED_BACK,
    /**
     * The row was requeued but the task could not be submitted.
     */
    SUBMIT_FAILED
}
