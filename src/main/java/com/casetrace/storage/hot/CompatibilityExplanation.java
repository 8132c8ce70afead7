package com.casetrace.storage.hot;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Human readable account of a version mismatch for the UI to render.
 */
public class CompatibilityExplanation {

    /**
     * Why the index was rejected
     */
    public enum Reason {
        NO_MARKER,
        UNREADABLE_MARKER,
        VERSION_CHANGED
    }

    /**
     * The only remedy offered for a mismatch
     */
    public enum Remedy {
        FULL_REINDEX
    }

    @JsonProperty("title")
    private final String title;

    @JsonProperty("reason")
    private final Reason reason;

    @JsonProperty("index_version")
    private final String indexVersion;

    @JsonProperty("code_version")
    private final String codeVersion;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("remedy")
    private final Remedy remedy = Remedy.FULL_REINDEX;

    public CompatibilityExplanation(String title, Reason reason, String indexVersion,
                                    String codeVersion, String message) {
        this.title = title;
        this.reason = reason;
        this.indexVersion = indexVersion;
        this.codeVersion = codeVersion;
        this.message = message;
    }

    public String getTitle() {
        return title;
    }

    public Reason getReason() {
        return reason;
    }

    public String getIndexVersion() {
        return indexVersion;
    }

    public String getCodeVersion() {
        return codeVersion;
    }

    public String getMessage() {
        return message;
    }

    public Remedy getRemedy() {
        return remedy;
    }

    @Override
    public String toString() {
        return title + ": " + message;
    }
}
