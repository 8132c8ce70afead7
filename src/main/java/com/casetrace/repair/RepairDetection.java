package com.casetrace.repair;

/**
 * Inconsistencies a repair pass looks for, in the order they are checked.
 */
public enum RepairDetection {

    /**
     * Failed file that is really empty, or a one-event collection artifact.
     */
    ZERO_EVENT_MISCLASSIFIED,

    /**
     * In-flight status whose task is no longer running or waiting.
     */
    STUCK_PROCESSING,

    /**
     * Completed file with events whose case index is gone.
     */
    MISSING_INDEX,

    /**
     * File with events that is not flagged as indexed.
     */
    FLAG_INCONSISTENT,

    /**
     * Queued file with no live task while the queue is idle.
     */
    STUCK_QUEUED
}
