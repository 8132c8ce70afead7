package com.casetrace.ingestion;

/**
 * Counts reported by one {@link DetectionStage}.
 */
public class DetectionResult {

    private final long flaggedEvents;
    private final long violations;

    public DetectionResult(long flaggedEvents, long violations) {
        this.flaggedEvents = flaggedEvents;
        this.violations = violations;
    }

    public static DetectionResult none() {
        return new DetectionResult(0, 0);
    }

    public long getFlaggedEvents() {
        return flaggedEvents;
    }

    /**
     * Rule hits, which can exceed the flagged event count when several rules
     * match the same event
     */
    public long getViolations() {
        return violations;
    }
}
