package com.casetrace.dedup;

import com.casetrace.domain.EventLogRecord;
import com.casetrace.domain.NormalizedFields;
import com.casetrace.domain.SourceRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds deterministic document ids so that re-ingesting the same logical
 * event, from the same file or another one, overwrites instead of
 * duplicating.
 *
 * The key is {@code case_<id>_evt_<eventId>_<host>_<timestamp to the second>_<hash>}.
 * Two records whose relevant payload, host, event id and whole-second
 * timestamp agree collapse to one key. Sub-second differences are ignored.
 */
@Component
public class DedupKeyGenerator {

    private static final Logger log = LoggerFactory.getLogger(DedupKeyGenerator.class);

    public static final int MAX_KEY_LENGTH = 200;
    static final String UNKNOWN = "unknown";

    private static final Pattern UNSAFE = Pattern.compile("[/\\\\:\\s?#&%]");

    /**
     * Ingestion metadata that must not influence the payload hash of flat records
     */
    static final Set<String> METADATA_FIELDS = Set.of(
        NormalizedFields.TIMESTAMP_FIELD,
        NormalizedFields.HOST_FIELD,
        NormalizedFields.EVENT_ID_FIELD,
        "System",
        "source_file", "source_file_type", "file_id", "case_id",
        "opensearch_key", "row_number",
        "has_sigma", "has_ioc", "ioc_count", "is_hidden",
        "search_blob", "indexed_at", "event_dedup_key"
    );

    private final PayloadHasher hasher;

    public DedupKeyGenerator() {
        this(new PayloadHasher());
    }

    public DedupKeyGenerator(PayloadHasher hasher) {
        this.hasher = hasher;
    }

    public DedupKey dedupKey(long caseId, NormalizedFields fields, SourceRecord record) {
        if (caseId < 0) {
            throw new IllegalArgumentException("caseId must not be negative");
        }
        NormalizedFields normalized = fields != null ? fields : NormalizedFields.empty();

        String timestamp = normalized.getTimestamp()
            .map(ts -> ts.length() >= 19 ? ts.substring(0, 19) : ts)
            .orElse(UNKNOWN);
        String host = normalized.getHost().orElse(UNKNOWN);
        String eventId = normalized.getEventId().orElse(UNKNOWN);

        DedupKey.Basis basis;
        String hash;
        Optional<Object> payload = relevantPayload(record);
        try {
            if (payload.isPresent()) {
                hash = hasher.hashJson(payload.get());
                basis = DedupKey.Basis.PAYLOAD;
            } else if (!normalized.isEmpty()) {
                hash = hasher.hashText(timestamp + "|" + host + "|" + eventId);
                basis = DedupKey.Basis.NORMALIZED_FIELDS;
            } else {
                hash = hashRaw(record);
                basis = DedupKey.Basis.RAW_RECORD;
            }
        } catch (JsonProcessingException e) {
            log.warn("Payload of {} could not be serialized, hashing raw record: {}", record, e.getMessage());
            hash = hashRaw(record);
            basis = DedupKey.Basis.RAW_RECORD;
        }

        String key = String.join("_",
            "case_" + caseId,
            "evt_" + eventId,
            host,
            timestamp,
            hash);

        return new DedupKey(sanitize(key), basis);
    }

    /**
     * Replace characters unsafe in document ids and cap the length.
     */
    static String sanitize(String key) {
        String safe = UNSAFE.matcher(key).replaceAll("_");
        return safe.length() > MAX_KEY_LENGTH ? safe.substring(0, MAX_KEY_LENGTH) : safe;
    }

    /**
     * The part of a record describing what happened: the EventData block for
     * event logs, otherwise every non-metadata field.
     */
    Optional<Object> relevantPayload(SourceRecord record) {
        if (record == null) {
            return Optional.empty();
        }
        if (record instanceof EventLogRecord) {
            return ((EventLogRecord) record).eventData().filter(DedupKeyGenerator::isNonEmpty);
        }
        Map<String, Object> content = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : record.getFields().entrySet()) {
            if (!METADATA_FIELDS.contains(entry.getKey())) {
                content.put(entry.getKey(), entry.getValue());
            }
        }
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    private String hashRaw(SourceRecord record) {
        if (record == null) {
            return hasher.hashText("");
        }
        try {
            return hasher.hashJson(record.getFields());
        } catch (JsonProcessingException e) {
            return hasher.hashText(String.valueOf(record.getFields()));
        }
    }

    private static boolean isNonEmpty(Object value) {
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return value != null;
    }
}
