package com.casetrace.domain;

import java.util.Map;

/**
 * Flat EDR / common-schema document such as an agent NDJSON line.
 */
public class CommonSchemaRecord extends SourceRecord {

    public CommonSchemaRecord(Map<String, Object> fields) {
        super(SourceFormat.EDR, fields);
    }
}
