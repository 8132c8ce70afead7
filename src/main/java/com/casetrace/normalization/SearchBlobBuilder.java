package com.casetrace.normalization;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens the descriptive parts of a record into one whitespace-normalized
 * string, so phrase searches are not broken by embedded line breaks.
 */
@Component
public class SearchBlobBuilder {

    public static final String FIELD = "search_blob";

    static final int MAX_DEPTH = 10;
    static final int MAX_LENGTH = 32 * 1024;

    private static final List<String> TOP_LEVEL_SOURCES = List.of("EventData", "Data", "UserData", "message");
    private static final List<String> WRAPPED_SOURCES = List.of("EventData", "UserData");

    public String build(Map<String, Object> document) {
        List<String> parts = new ArrayList<>();

        for (String key : TOP_LEVEL_SOURCES) {
            if (document.containsKey(key)) {
                parts.add(extractText(document.get(key), 0));
            }
        }

        Object wrapper = document.get("Event");
        if (wrapper instanceof Map) {
            Map<?, ?> event = (Map<?, ?>) wrapper;
            for (String key : WRAPPED_SOURCES) {
                if (event.containsKey(key)) {
                    parts.add(extractText(event.get(key), 0));
                }
            }
        }

        String blob = String.join(" ", parts).trim().replaceAll("\\s+", " ");
        return blob.length() > MAX_LENGTH ? blob.substring(0, MAX_LENGTH) : blob;
    }

    /**
     * Build the blob and attach it when non-empty.
     */
    public void attach(Map<String, Object> document) {
        String blob = build(document);
        if (!blob.isEmpty()) {
            document.put(FIELD, blob);
        }
    }

    private String extractText(Object value, int depth) {
        if (depth > MAX_DEPTH || value == null) {
            return "";
        }
        if (value instanceof String) {
            return ((String) value)
                .replace("\\r\\n", " ").replace("\\n", " ").replace("\\r", " ")
                .replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        }
        if (value instanceof Map) {
            return joinNonEmpty(((Map<?, ?>) value).values(), depth);
        }
        if (value instanceof Iterable) {
            return joinNonEmpty((Iterable<?>) value, depth);
        }
        return value.toString();
    }

    private String joinNonEmpty(Iterable<?> values, int depth) {
        StringBuilder sb = new StringBuilder();
        for (Object item : values) {
            String text = extractText(item, depth + 1);
            if (!text.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(text);
            }
        }
        return sb.toString();
    }
}
