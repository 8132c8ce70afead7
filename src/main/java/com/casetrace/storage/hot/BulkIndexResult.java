package com.casetrace.storage.hot;

/**
 * Outcome of one bulk request.
 */
public class BulkIndexResult {

    private final int succeeded;
    private final int failed;
    private final String failureMessage;

    public BulkIndexResult(int succeeded, int failed, String failureMessage) {
        this.succeeded = succeeded;
        this.failed = failed;
        this.failureMessage = failureMessage;
    }

    public static BulkIndexResult empty() {
        return new BulkIndexResult(0, 0, null);
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
