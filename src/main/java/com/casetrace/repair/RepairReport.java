package com.casetrace.repair;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What a repair pass found and did.
 */
public class RepairReport {

    @JsonProperty("dry_run")
    private final boolean dryRun;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("files_scanned")
    private int filesScanned;

    @JsonProperty("cases_scanned")
    private int casesScanned;

    @JsonProperty("failed_batches")
    private int failedBatches;

    @JsonProperty("actions")
    private final List<RepairAction> actions = new ArrayList<>();

    public RepairReport(boolean dryRun, Instant startedAt) {
        this.dryRun = dryRun;
        this.startedAt = startedAt;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public int getFilesScanned() {
        return filesScanned;
    }

    void addFilesScanned(int count) {
        this.filesScanned += count;
    }

    public int getCasesScanned() {
        return casesScanned;
    }

    void incrementCasesScanned() {
        this.casesScanned++;
    }

    /**
     * Case batches that were rolled back or could not be planned
     */
    public int getFailedBatches() {
        return failedBatches;
    }

    void incrementFailedBatches() {
        this.failedBatches++;
    }

    public List<RepairAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    void addAction(RepairAction action) {
        actions.add(action);
    }

    public List<RepairAction> actionsFor(RepairDetection detection) {
        List<RepairAction> result = new ArrayList<>();
        for (RepairAction action : actions) {
            if (action.getDetection() == detection) {
                result.add(action);
            }
        }
        return result;
    }

    public Map<RepairOutcome, Integer> countByOutcome() {
        Map<RepairOutcome, Integer> counts = new EnumMap<>(RepairOutcome.class);
        for (RepairAction action : actions) {
            if (action.getOutcome() != null) {
                counts.merge(action.getOutcome(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public int appliedCount() {
        return countByOutcome().getOrDefault(RepairOutcome.APPLIED, 0);
    }

    /**
     * @return true when nothing needed repair
     */
    public boolean isClean() {
        return actions.isEmpty() && failedBatches == 0;
    }

    @Override
    public String toString() {
        return "RepairReport{dryRun=" + dryRun + ", cases=" + casesScanned + ", files=" + filesScanned
            + ", actions=" + actions.size() + ", outcomes=" + countByOutcome()
            + ", failedBatches=" + failedBatches + "}";
    }
}
