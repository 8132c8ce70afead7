package com.casetrace.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical (timestamp, host, event id) triple extracted from a record.
 * Unresolved values stay absent; they are never empty strings.
 */
public class NormalizedFields {

    public static final String TIMESTAMP_FIELD = "normalized_timestamp";
    public static final String HOST_FIELD = "normalized_computer";
    public static final String EVENT_ID_FIELD = "normalized_event_id";

    private final String timestamp;
    private final String host;
    private final String eventId;

    public NormalizedFields(String timestamp, String host, String eventId) {
        this.timestamp = blankToNull(timestamp);
        this.host = blankToNull(host);
        this.eventId = blankToNull(eventId);
    }

    public static NormalizedFields empty() {
        return new NormalizedFields(null, null, null);
    }

    public Optional<String> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<String> getHost() {
        return Optional.ofNullable(host);
    }

    public Optional<String> getEventId() {
        return Optional.ofNullable(eventId);
    }

    public boolean isEmpty() {
        return timestamp == null && host == null && eventId == null;
    }

    /**
     * Attach the resolved values to a document. Absent values are not written.
     */
    public void applyTo(Map<String, Object> document) {
        if (timestamp != null) {
            document.put(TIMESTAMP_FIELD, timestamp);
        }
        if (host != null) {
            document.put(HOST_FIELD, host);
        }
        if (eventId != null) {
            document.put(EVENT_ID_FIELD, eventId);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizedFields that = (NormalizedFields) o;
        return Objects.equals(timestamp, that.timestamp)
            && Objects.equals(host, that.host)
            && Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, host, eventId);
    }

    @Override
    public String toString() {
        return "NormalizedFields{timestamp=" + timestamp + ", host=" + host + ", eventId=" + eventId + "}";
    }
}
