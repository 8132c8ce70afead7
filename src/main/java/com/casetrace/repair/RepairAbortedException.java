package com.casetrace.repair;

/**
 * A repair pass stopped before writing anything because task liveness could
 * not be established.
 */
public class RepairAbortedException extends RuntimeException {

    public RepairAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
