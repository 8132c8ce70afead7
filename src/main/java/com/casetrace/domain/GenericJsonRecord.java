package com.casetrace.domain;

import java.util.Map;

/**
 * Fallback for JSON with no recognised structure.
 */
public class GenericJsonRecord extends SourceRecord {

    public GenericJsonRecord(SourceFormat format, Map<String, Object> fields) {
        super(format, fields);
    }

    public GenericJsonRecord(Map<String, Object> fields) {
        this(SourceFormat.JSON, fields);
    }
}
