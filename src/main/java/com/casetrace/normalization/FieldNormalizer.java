package com.casetrace.normalization;

import com.casetrace.domain.NormalizedFields;
import com.casetrace.domain.SourceRecord;
import com.casetrace.normalization.extractors.FieldExtractor;
import com.casetrace.normalization.extractors.FlatFieldExtractor;
import com.casetrace.normalization.extractors.StructuredFieldExtractor;
import com.casetrace.normalization.extractors.TabularFallbackExtractor;
import com.casetrace.normalization.extractors.ValueReaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the canonical timestamp, host and event id of a record.
 *
 * Each field has its own ordered extractor chain; the first extractor that
 * yields a value wins and values from different extractors are never
 * combined. The result depends only on the record's content and its declared
 * format.
 */
@Component
public class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    public static final String FIREWALL_HOST = "Firewall";
    public static final String CSV_EVENT_ID = "CSV";

    static final List<String> TIMESTAMP_FIELDS = List.of(
        "@timestamp", "timestamp", "Time", "time", "datetime",
        "TimeCreated", "timeCreated", "event_time", "eventtime",
        "created_at", "createdAt", "date", "Date",
        "TIME_CREATED", "CreatedDate", "created"
    );

    static final List<String> HOST_FIELDS = List.of(
        "computer_name", "ComputerName", "computername",
        "hostname", "Hostname", "host_name", "HostName",
        "machine", "Machine", "device", "Device",
        "agent", "Agent", "host", "Host",
        "Dst. Name", "Source Name", "Destination Name"
    );

    static final List<String> EVENT_ID_FIELDS = List.of(
        "event_id", "eventid", "EventID", "event.id",
        "Event", "ID",
        "event_type", "EventType", "event_name", "EventName"
    );

    static final List<String> FIREWALL_COLUMNS = List.of(
        "Src. IP", "Dst. IP", "Firewall", "Category", "Group"
    );

    private static final String[][] SYSTEM_TIME_PATHS = {
        {"TimeCreated", "#attributes", "SystemTime"},
        {"TimeCreated", "@attributes", "SystemTime"}
    };

    private final List<FieldExtractor> timestampChain;
    private final List<FieldExtractor> hostChain;
    private final List<FieldExtractor> eventIdChain;
    private final TimestampParser timestampParser;

    public FieldNormalizer() {
        this(new TimestampParser());
    }

    public FieldNormalizer(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;

        this.timestampChain = List.of(
            new StructuredFieldExtractor("system-time", false, ValueReaders::scalar, SYSTEM_TIME_PATHS),
            new StructuredFieldExtractor("wrapped-system-time", true, ValueReaders::scalar, SYSTEM_TIME_PATHS),
            new FlatFieldExtractor("flat-time", TIMESTAMP_FIELDS, ValueReaders::scalar)
        );

        this.hostChain = List.of(
            new StructuredFieldExtractor("system-computer", false, ValueReaders::scalar,
                new String[] {"Computer"}),
            new StructuredFieldExtractor("wrapped-system-computer", true, ValueReaders::scalar,
                new String[] {"Computer"}),
            new FlatFieldExtractor("flat-host", HOST_FIELDS, ValueReaders::scalarOrName),
            new TabularFallbackExtractor("firewall-host", FIREWALL_HOST, FIREWALL_COLUMNS)
        );

        this.eventIdChain = List.of(
            new StructuredFieldExtractor("system-event-id", false, ValueReaders::scalarOrText,
                new String[] {"EventID"}),
            new StructuredFieldExtractor("wrapped-system-event-id", true, ValueReaders::scalarOrText,
                new String[] {"EventID"}),
            new FlatFieldExtractor("flat-event-id", EVENT_ID_FIELDS, ValueReaders::scalar),
            new TabularFallbackExtractor("csv-event-id", CSV_EVENT_ID, List.of("Event"))
        );
    }

    /**
     * Extract the normalized triple. Never throws for malformed input.
     */
    public NormalizedFields normalize(SourceRecord record) {
        if (record == null) {
            return NormalizedFields.empty();
        }

        String timestamp = null;
        Optional<String> rawTime = FieldExtractor.firstPresent(timestampChain, record);
        if (rawTime.isPresent()) {
            timestamp = timestampParser.parse(rawTime.get()).orElse(null);
            if (timestamp == null) {
                log.debug("Could not parse timestamp '{}' on {}", rawTime.get(), record);
            }
        }

        String host = FieldExtractor.firstPresent(hostChain, record).orElse(null);
        String eventId = FieldExtractor.firstPresent(eventIdChain, record).orElse(null);

        return new NormalizedFields(timestamp, host, eventId);
    }

    /**
     * Normalize and write the result onto the record's own field map.
     */
    public NormalizedFields normalizeInPlace(SourceRecord record) {
        NormalizedFields fields = normalize(record);
        fields.applyTo(record.getFields());
        return fields;
    }
}
