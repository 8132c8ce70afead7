package com.casetrace.tasks;

/**
 * Unit of background work: index one source file.
 *
 * The task id is normally chosen by the caller and persisted on the file row
 * before submission, so the row always names the task that owns it.
 */
public class FileProcessingTask {

    private String taskId;
    private long fileId;
    private long caseId;

    public FileProcessingTask() {
    }

    public FileProcessingTask(String taskId, long fileId, long caseId) {
        this.taskId = taskId;
        this.fileId = fileId;
        this.caseId = caseId;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public long getFileId() {
        return fileId;
    }

    public void setFileId(long fileId) {
        this.fileId = fileId;
    }

    public long getCaseId() {
        return caseId;
    }

    public void setCaseId(long caseId) {
        this.caseId = caseId;
    }

    @Override
    public String toString() {
        return "FileProcessingTask{taskId='" + taskId + "', fileId=" + fileId + ", caseId=" + caseId + "}";
    }
}
