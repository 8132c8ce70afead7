package com.casetrace.ingestion;

/**
 * Indexing of one file failed. The file row has already been marked failed.
 */
public class FileIndexingException extends RuntimeException {

    private final long fileId;

    public FileIndexingException(long fileId, String message, Throwable cause) {
        super(message, cause);
        this.fileId = fileId;
    }

    public long getFileId() {
        return fileId;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [File: " + fileId + "]";
    }
}
