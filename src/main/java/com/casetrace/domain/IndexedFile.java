package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted processing state of one uploaded source file.
 *
 * Rows are created by the upload flow and deleted by case management;
 * ingestion and repair only move them through the processing states.
 */
public class IndexedFile {

    @JsonProperty("id")
    private long id;

    @JsonProperty("case_id")
    private long caseId;

    @JsonProperty("original_filename")
    private String originalFilename;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("file_hash")
    private String fileHash;

    @JsonProperty("file_type")
    private String fileType;

    /**
     * Raw status string, see {@link ProcessingStatus}
     */
    @JsonProperty("indexing_status")
    private String indexingStatus;

    @JsonProperty("event_count")
    private long eventCount;

    @JsonProperty("violation_count")
    private long violationCount;

    @JsonProperty("sigma_event_count")
    private long sigmaEventCount;

    @JsonProperty("ioc_event_count")
    private long iocEventCount;

    @JsonProperty("is_indexed")
    private boolean indexed;

    @JsonProperty("is_hidden")
    private boolean hidden;

    @JsonProperty("is_deleted")
    private boolean deleted;

    @JsonProperty("index_key")
    private String indexKey;

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("uploaded_at")
    private Instant uploadedAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public IndexedFile() {
        this.indexingStatus = ProcessingStatus.QUEUED.getValue();
    }

    /**
     * Copy constructor, used to take a snapshot before planning changes
     */
    public IndexedFile(IndexedFile other) {
        this.id = other.id;
        this.caseId = other.caseId;
        this.originalFilename = other.originalFilename;
        this.filePath = other.filePath;
        this.fileHash = other.fileHash;
        this.fileType = other.fileType;
        this.indexingStatus = other.indexingStatus;
        this.eventCount = other.eventCount;
        this.violationCount = other.violationCount;
        this.sigmaEventCount = other.sigmaEventCount;
        this.iocEventCount = other.iocEventCount;
        this.indexed = other.indexed;
        this.hidden = other.hidden;
        this.deleted = other.deleted;
        this.indexKey = other.indexKey;
        this.taskId = other.taskId;
        this.uploadedAt = other.uploadedAt;
        this.updatedAt = other.updatedAt;
    }

    public boolean hasStatus(ProcessingStatus status) {
        return status.getValue().equals(indexingStatus);
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getCaseId() {
        return caseId;
    }

    public void setCaseId(long caseId) {
        this.caseId = caseId;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public void setOriginalFilename(String originalFilename) {
        this.originalFilename = originalFilename;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public String getFileHash() {
        return fileHash;
    }

    public void setFileHash(String fileHash) {
        this.fileHash = fileHash;
    }

    public String getFileType() {
        return fileType;
    }

    public void setFileType(String fileType) {
        this.fileType = fileType;
    }

    public String getIndexingStatus() {
        return indexingStatus;
    }

    public void setIndexingStatus(String indexingStatus) {
        this.indexingStatus = indexingStatus;
    }

    public long getEventCount() {
        return eventCount;
    }

    public void setEventCount(long eventCount) {
        this.eventCount = eventCount;
    }

    public long getViolationCount() {
        return violationCount;
    }

    public void setViolationCount(long violationCount) {
        this.violationCount = violationCount;
    }

    public long getSigmaEventCount() {
        return sigmaEventCount;
    }

    public void setSigmaEventCount(long sigmaEventCount) {
        this.sigmaEventCount = sigmaEventCount;
    }

    public long getIocEventCount() {
        return iocEventCount;
    }

    public void setIocEventCount(long iocEventCount) {
        this.iocEventCount = iocEventCount;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public void setIndexed(boolean indexed) {
        this.indexed = indexed;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public String getIndexKey() {
        return indexKey;
    }

    public void setIndexKey(String indexKey) {
        this.indexKey = indexKey;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public Instant getUploadedAt() {
        return uploadedAt;
    }

    public void setUploadedAt(Instant uploadedAt) {
        this.uploadedAt = uploadedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "IndexedFile{" +
            "id=" + id +
            ", caseId=" + caseId +
            ", originalFilename='" + originalFilename + '\'' +
            ", indexingStatus='" + indexingStatus + '\'' +
            ", eventCount=" + eventCount +
            ", indexed=" + indexed +
            ", hidden=" + hidden +
            ", taskId='" + taskId + '\'' +
            '}';
    }
}
