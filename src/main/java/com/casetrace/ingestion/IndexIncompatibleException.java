package com.casetrace.ingestion;

import com.casetrace.storage.hot.CompatibilityExplanation;

/**
 * New events were refused because the case index was written by an
 * incompatible version.
 */
public class IndexIncompatibleException extends RuntimeException {

    private final long caseId;
    private final CompatibilityExplanation explanation;

    public IndexIncompatibleException(long caseId, CompatibilityExplanation explanation) {
        super(explanation.getTitle() + " for case " + caseId + ": " + explanation.getMessage());
        this.caseId = caseId;
        this.explanation = explanation;
    }

    public long getCaseId() {
        return caseId;
    }

    public CompatibilityExplanation getExplanation() {
        return explanation;
    }
}
