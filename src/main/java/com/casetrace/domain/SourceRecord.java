package com.casetrace.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One ingested log entry, wrapped in the variant that matches its shape.
 *
 * The wrapped map is the live document that is later indexed, so fields
 * attached during ingestion (normalized values, source tags) land on it.
 */
public abstract class SourceRecord {

    private final SourceFormat format;
    private final Map<String, Object> fields;

    protected SourceRecord(SourceFormat format, Map<String, Object> fields) {
        this.format = format;
        this.fields = fields != null ? fields : new LinkedHashMap<>();
    }

    /**
     * Wrap a raw map in the variant matching the declared format and the
     * map's own structure.
     */
    public static SourceRecord of(SourceFormat declared, Map<String, Object> fields) {
        SourceFormat format = declared != null ? declared : SourceFormat.JSON;
        if (format == SourceFormat.CSV) {
            return new TabularRecord(fields);
        }
        if (EventLogRecord.hasSystemBlock(fields)) {
            return new EventLogRecord(format, fields);
        }
        if (format == SourceFormat.EDR) {
            return new CommonSchemaRecord(fields);
        }
        return new GenericJsonRecord(format, fields);
    }

    public SourceFormat getFormat() {
        return format;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Map<String, Object> view() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * Walk nested maps along the given keys.
     */
    public Optional<Object> path(String... keys) {
        return walk(fields, keys);
    }

    /**
     * Resolve a possibly dotted field name: the literal key wins, then the
     * dotted segments are walked as nested maps.
     */
    public Optional<Object> lookup(String name) {
        if (fields.containsKey(name)) {
            return Optional.ofNullable(fields.get(name));
        }
        if (name.indexOf('.') < 0) {
            return Optional.empty();
        }
        return walk(fields, name.split("\\."));
    }

    @SuppressWarnings("unchecked")
    protected static Optional<Object> walk(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            current = ((Map<String, Object>) current).get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{format=" + format + ", fields=" + fields.size() + "}";
    }
}
