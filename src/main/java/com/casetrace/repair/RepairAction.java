package com.casetrace.repair;

import com.casetrace.domain.IndexedFile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One planned change to one file row.
 */
public class RepairAction {

    @JsonProperty("file_id")
    private final long fileId;

    @JsonProperty("case_id")
    private final long caseId;

    @JsonProperty("detection")
    private final RepairDetection detection;

    @JsonProperty("from_status")
    private final String fromStatus;

    @JsonProperty("to_status")
    private final String toStatus;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("outcome")
    private RepairOutcome outcome;

    @JsonIgnore
    private final IndexedFile expected;

    @JsonIgnore
    private final IndexedFile updated;

    public RepairAction(RepairDetection detection, IndexedFile expected, IndexedFile updated, String description) {
        this.fileId = expected.getId();
        this.caseId = expected.getCaseId();
        this.detection = detection;
        this.fromStatus = expected.getIndexingStatus();
        this.toStatus = updated.getIndexingStatus();
        this.description = description;
        this.expected = expected;
        this.updated = updated;
    }

    public long getFileId() {
        return fileId;
    }

    public long getCaseId() {
        return caseId;
    }

    public RepairDetection getDetection() {
        return detection;
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }

    public String getDescription() {
        return description;
    }

    public RepairOutcome getOutcome() {
        return outcome;
    }

    void setOutcome(RepairOutcome outcome) {
        this.outcome = outcome;
    }

    IndexedFile getExpected() {
        return expected;
    }

    IndexedFile getUpdated() {
        return updated;
    }

    @Override
    public String toString() {
        return detection + " file " + fileId + " (case " + caseId + "): '" + fromStatus + "' -> '"
            + toStatus + "', " + description + (outcome != null ? " [" + outcome + "]" : "");
    }
}
