package com.casetrace.storage.hot;

import java.util.Optional;

/**
 * Outcome of checking a case index against the current schema version.
 */
public class CompatibilityResult {

    private final boolean compatible;
    private final String storedVersion;
    private final String currentVersion;
    private final boolean markerUnreadable;

    public CompatibilityResult(boolean compatible, String storedVersion, String currentVersion) {
        this(compatible, storedVersion, currentVersion, false);
    }

    private CompatibilityResult(boolean compatible, String storedVersion, String currentVersion,
                                boolean markerUnreadable) {
        this.compatible = compatible;
        this.storedVersion = storedVersion;
        this.currentVersion = currentVersion;
        this.markerUnreadable = markerUnreadable;
    }

    /**
     * Incompatible because the index or its marker could not be read.
     */
    public static CompatibilityResult unreadable(String storedVersion, String currentVersion) {
        return new CompatibilityResult(false, storedVersion, currentVersion, true);
    }

    public boolean isCompatible() {
        return compatible;
    }

    /**
     * Marker found on the index; empty when the index does not exist yet
     */
    public Optional<String> getStoredVersion() {
        return Optional.ofNullable(storedVersion);
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public boolean isMarkerUnreadable() {
        return markerUnreadable;
    }

    @Override
    public String toString() {
        return "CompatibilityResult{compatible=" + compatible +
            ", storedVersion=" + storedVersion +
            ", currentVersion=" + currentVersion +
            ", markerUnreadable=" + markerUnreadable + "}";
    }
}
