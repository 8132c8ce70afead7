package com.casetrace.domain;

import java.util.Map;

/**
 * One CSV row keyed by header name.
 */
public class TabularRecord extends SourceRecord {

    public TabularRecord(Map<String, Object> fields) {
        super(SourceFormat.CSV, fields);
    }
}
