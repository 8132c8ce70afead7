package com.casetrace.storage.hot;

/**
 * Naming of per-case indices. All files of a case share one index.
 */
public final class IndexNames {

    private static final String PREFIX = "case_";

    private IndexNames() {
    }

    public static String prefix() {
        return PREFIX;
    }

    public static String forCase(long caseId) {
        if (caseId < 0) {
            throw new IllegalArgumentException("caseId must not be negative: " + caseId);
        }
        return PREFIX + caseId;
    }
}
