package com.casetrace.storage.hot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guards case indices against mixing documents written under different
 * field layouts.
 *
 * Each case index carries a version marker. A missing or different marker
 * means the index must be rebuilt from scratch; it is never patched in place.
 * Any failure while reading the marker counts as incompatible.
 *
 * <p>An ingest that found no index creates it with its first bulk write and
 * stamps it right after. Until then the index exists without a marker, so
 * such ingests register themselves and a markerless index of a case with a
 * registered first write is not rejected.
 */
@Component
public class IndexCompatibilityGate {
    private static final Logger logger = LoggerFactory.getLogger(IndexCompatibilityGate.class);

    /**
     * Bump whenever the document layout changes in a way existing mappings
     * cannot absorb.
     */
    public static final String CURRENT_VERSION = "1.19.8";

    public static final String MARKER_KEY = "casetrace_version";
    public static final String NO_MARKER = "pre-versioning";
    public static final String UNKNOWN_VERSION = "unknown";

    static final Map<String, String> VERSION_HISTORY = new LinkedHashMap<>();

    static {
        VERSION_HISTORY.put("1.19.8", "EventData/UserData normalized, forensic fields extracted");
        VERSION_HISTORY.put("1.19.3", "Forensic field extraction added");
        VERSION_HISTORY.put("1.13.9", "EventData/UserData stored as JSON strings");
        VERSION_HISTORY.put("1.13.4", "Event structure normalization added");
    }

    private final IndexSettingStore settingStore;
    private final Map<Long, Integer> pendingFirstWrites = new ConcurrentHashMap<>();

    public IndexCompatibilityGate(IndexSettingStore settingStore) {
        this.settingStore = settingStore;
    }

    public CompatibilityResult checkCompatible(long caseId) {
        String index = IndexNames.forCase(caseId);
        try {
            if (!settingStore.indexExists(index)) {
                logger.debug("Index {} does not exist yet, new documents will define its layout", index);
                return new CompatibilityResult(true, null, CURRENT_VERSION);
            }

            Optional<String> stored = settingStore.getSetting(index, MARKER_KEY);
            if (stored.isEmpty()) {
                if (pendingFirstWrites.containsKey(caseId)) {
                    logger.debug("Index {} is being created by a running ingest, marker not written yet", index);
                    return new CompatibilityResult(true, null, CURRENT_VERSION);
                }
                logger.warn("Index {} has no version marker, treating as incompatible", index);
                return new CompatibilityResult(false, NO_MARKER, CURRENT_VERSION);
            }

            boolean compatible = CURRENT_VERSION.equals(stored.get());
            if (!compatible) {
                logger.warn("Index {} was written under version {}, code is at {}",
                    index, stored.get(), CURRENT_VERSION);
            }
            return new CompatibilityResult(compatible, stored.get(), CURRENT_VERSION);

        } catch (Exception e) {
            logger.error("Version check failed for {}, treating as incompatible", index, e);
            return CompatibilityResult.unreadable(UNKNOWN_VERSION, CURRENT_VERSION);
        }
    }

    /**
     * Register an ingest that will create the case index. Pair with
     * {@link #endFirstWrite(long)} once the marker is written or the ingest gave up.
     */
    public void beginFirstWrite(long caseId) {
        pendingFirstWrites.merge(caseId, 1, Integer::sum);
    }

    public void endFirstWrite(long caseId) {
        pendingFirstWrites.computeIfPresent(caseId, (id, count) -> count > 1 ? count - 1 : null);
    }

    boolean isFirstWritePending(long caseId) {
        return pendingFirstWrites.containsKey(caseId);
    }

    /**
     * Write the current version marker. The index is created lazily by the
     * first document write, so this is a no-op until it exists.
     *
     * @return true when the marker was written
     */
    public boolean stampVersion(long caseId) {
        String index = IndexNames.forCase(caseId);
        try {
            if (!settingStore.indexExists(index)) {
                logger.warn("Cannot stamp {}: index does not exist", index);
                return false;
            }
            settingStore.putSetting(index, MARKER_KEY, CURRENT_VERSION);
            logger.info("Stamped {} with version {}", index, CURRENT_VERSION);
            return true;
        } catch (Exception e) {
            logger.error("Failed to stamp version on {}", index, e);
            return false;
        }
    }

    public CompatibilityExplanation explain(CompatibilityResult result) {
        String stored = result.getStoredVersion().orElse(NO_MARKER);
        String current = result.getCurrentVersion();

        CompatibilityExplanation.Reason reason;
        String detail;
        if (result.isMarkerUnreadable()) {
            reason = CompatibilityExplanation.Reason.UNREADABLE_MARKER;
            detail = "The index version could not be read.";
        } else if (NO_MARKER.equals(stored)) {
            reason = CompatibilityExplanation.Reason.NO_MARKER;
            detail = "The index was created before version tracking and carries no version marker.";
        } else {
            reason = CompatibilityExplanation.Reason.VERSION_CHANGED;
            detail = String.format("Index version %s (%s) does not match code version %s (%s).",
                stored, describe(stored), current, describe(current));
        }

        String message = detail
            + " Existing documents may use field mappings that reject or misrepresent new events."
            + " Re-index every file in this case to rebuild the index.";

        return new CompatibilityExplanation("Index Version Mismatch Detected", reason, stored, current, message);
    }

    static String describe(String version) {
        return VERSION_HISTORY.getOrDefault(version, "unknown changes");
    }
}
