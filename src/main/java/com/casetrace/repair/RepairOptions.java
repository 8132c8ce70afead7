package com.casetrace.repair;

import java.time.Duration;
import java.util.Optional;

/**
 * Parameters of one repair pass.
 */
public class RepairOptions {

    private boolean dryRun;
    private Duration lookback;
    private Long caseId;

    public static RepairOptions defaults() {
        return new RepairOptions();
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public RepairOptions setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    /**
     * Only files updated within this window are checked for a missing index.
     * Empty checks every completed file.
     */
    public Optional<Duration> getLookback() {
        return Optional.ofNullable(lookback);
    }

    public RepairOptions setLookback(Duration lookback) {
        this.lookback = lookback;
        return this;
    }

    public Optional<Long> getCaseId() {
        return Optional.ofNullable(caseId);
    }

    public RepairOptions setCaseId(Long caseId) {
        this.caseId = caseId;
        return this;
    }

    @Override
    public String toString() {
        return "RepairOptions{dryRun=" + dryRun + ", lookback=" + lookback + ", caseId=" + caseId + "}";
    }
}
