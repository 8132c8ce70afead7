package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Processing states of an {@link IndexedFile}.
 *
 * The persisted column is a free-form string. Anything that is not one of
 * these values (for example {@code Failed} or {@code Error: ...}) is a
 * failed file.
 */
public enum ProcessingStatus {

    QUEUED("Queued"),
    INDEXING("Indexing"),
    SIGMA_TESTING("SIGMA Testing"),
    IOC_HUNTING("IOC Hunting"),
    COMPLETED("Completed");

    /**
     * Status written when indexing throws.
     */
    public static final String FAILED = "Failed";

    /**
     * Status written when the case index must be rebuilt before the file can
     * be indexed. Only an explicit re-index clears it.
     */
    public static final String VERSION_MISMATCH = "Error: index version mismatch";

    private static final Set<ProcessingStatus> IN_FLIGHT =
        EnumSet.of(INDEXING, SIGMA_TESTING, IOC_HUNTING);

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    public static Optional<ProcessingStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ProcessingStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * @return true when the stored status string is outside the known set
     */
    public static boolean isFailed(String value) {
        return fromValue(value).isEmpty();
    }

    public static boolean isInFlight(String value) {
        return fromValue(value).map(ProcessingStatus::isInFlight).orElse(false);
    }

    @Override
    public String toString() {
        return value;
    }
}
