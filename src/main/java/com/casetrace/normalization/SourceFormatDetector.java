package com.casetrace.normalization;

import com.casetrace.domain.SourceFormat;
import com.casetrace.domain.SourceRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Decides the source format of a file and of each record read from it.
 *
 * The file extension fixes EVTX and CSV. JSON files are classified record by
 * record, since a single collection can mix EDR lines with plain JSON.
 */
@Component
public class SourceFormatDetector {

    /**
     * Format implied by a file name alone. JSON files may still contain EDR
     * records, see {@link #detectRecord(SourceFormat, Map)}.
     */
    public SourceFormat detectFile(String filename) {
        if (filename == null) {
            return SourceFormat.JSON;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".evtx")) {
            return SourceFormat.EVTX;
        }
        if (lower.endsWith(".csv")) {
            return SourceFormat.CSV;
        }
        return SourceFormat.JSON;
    }

    public SourceFormat detectRecord(SourceFormat fileFormat, Map<String, Object> fields) {
        if (fileFormat == SourceFormat.EVTX || fileFormat == SourceFormat.CSV) {
            return fileFormat;
        }
        return isCommonSchema(fields) ? SourceFormat.EDR : SourceFormat.JSON;
    }

    /**
     * Classify a record and wrap it in the matching variant.
     */
    public SourceRecord wrap(SourceFormat fileFormat, Map<String, Object> fields) {
        return SourceRecord.of(detectRecord(fileFormat, fields), fields);
    }

    boolean isCommonSchema(Map<String, Object> fields) {
        if (fields == null) {
            return false;
        }
        if (fields.containsKey("@timestamp")
            && (fields.containsKey("process") || fields.containsKey("host") || fields.containsKey("agent"))) {
            return true;
        }
        Object event = fields.get("event");
        if (event instanceof Map) {
            Map<?, ?> eventMap = (Map<?, ?>) event;
            if (eventMap.containsKey("kind") || eventMap.containsKey("category")) {
                return true;
            }
        }
        return fields.containsKey("ecs");
    }
}
