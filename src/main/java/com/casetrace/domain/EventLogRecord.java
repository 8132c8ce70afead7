package com.casetrace.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Windows event log entry with a {@code System} block, either at the top
 * level or under an import wrapper ({@code Event.System}).
 */
public class EventLogRecord extends SourceRecord {

    public EventLogRecord(SourceFormat format, Map<String, Object> fields) {
        super(format, fields);
    }

    public EventLogRecord(Map<String, Object> fields) {
        this(SourceFormat.EVTX, fields);
    }

    static boolean hasSystemBlock(Map<String, Object> fields) {
        if (fields == null) {
            return false;
        }
        return fields.get("System") instanceof Map
            || walk(fields, "Event", "System").filter(v -> v instanceof Map).isPresent();
    }

    /**
     * @return true when the System block only exists under {@code Event}
     */
    public boolean isImportWrapped() {
        return !(get("System") instanceof Map) && path("Event", "System").isPresent();
    }

    public Optional<Object> system(String... keys) {
        return path(prefixed("System", keys));
    }

    public Optional<Object> wrappedSystem(String... keys) {
        return path(prefixed("Event", prefixed("System", keys)));
    }

    /**
     * The event payload: {@code EventData}, else {@code Event.EventData}.
     */
    public Optional<Object> eventData() {
        Optional<Object> direct = path("EventData");
        if (direct.isPresent()) {
            return direct;
        }
        return path("Event", "EventData");
    }

    private static String[] prefixed(String head, String... rest) {
        String[] keys = new String[rest.length + 1];
        keys[0] = head;
        System.arraycopy(rest, 0, keys, 1, rest.length);
        return keys;
    }
}
