package com.casetrace.dedup;

import java.util.Objects;

/**
 * Document id derived from record content, plus what the content hash was
 * taken from.
 */
public class DedupKey {

    /**
     * Source of the hash component, from most to least accurate
     */
    public enum Basis {
        PAYLOAD,
        NORMALIZED_FIELDS,
        RAW_RECORD
    }

    private final String value;
    private final Basis basis;

    public DedupKey(String value, Basis basis) {
        this.value = value;
        this.basis = basis;
    }

    public String getValue() {
        return value;
    }

    public Basis getBasis() {
        return basis;
    }

    public boolean isRawFallback() {
        return basis == Basis.RAW_RECORD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DedupKey dedupKey = (DedupKey) o;
        return value.equals(dedupKey.value) && basis == dedupKey.basis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, basis);
    }

    @Override
    public String toString() {
        return value;
    }
}
