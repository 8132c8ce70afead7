package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Source file formats the ingestion pipeline understands.
 *
 * The label is what gets written into the {@code source_file_type} field of
 * every indexed document and what the search filters match against.
 */
public enum SourceFormat {

    /**
     * Windows event log, converted to a nested System/EventData tree.
     */
    EVTX("EVTX"),

    /**
     * EDR / Elastic common schema NDJSON.
     */
    EDR("EDR"),

    /**
     * Arbitrary JSON with no recognised schema.
     */
    JSON("JSON"),

    /**
     * Tabular rows, typically firewall exports.
     */
    CSV("CSV");

    private final String label;

    SourceFormat(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolve a stored label back to a format.
     *
     * @param label value of {@code source_file_type}
     * @return the matching format, or empty when the label is unknown
     */
    public static Optional<SourceFormat> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (SourceFormat format : values()) {
            if (format.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
