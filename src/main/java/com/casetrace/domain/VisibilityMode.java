package com.casetrace.domain;

/**
 * How events from hidden files are treated in a search.
 */
public enum VisibilityMode {
    EXCLUDE_HIDDEN,
    INCLUDE_ALL,
    HIDDEN_ONLY
}
