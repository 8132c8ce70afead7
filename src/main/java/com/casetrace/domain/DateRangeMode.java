package com.casetrace.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Date windows for a search. Relative windows are measured back from the
 * newest event in the case, not from the current time.
 */
public enum DateRangeMode {
    ALL(null),
    LAST_24_HOURS(Duration.ofHours(24)),
    LAST_7_DAYS(Duration.ofDays(7)),
    LAST_30_DAYS(Duration.ofDays(30)),
    CUSTOM(null);

    private final Duration window;

    DateRangeMode(Duration window) {
        this.window = window;
    }

    public Optional<Duration> getWindow() {
        return Optional.ofNullable(window);
    }

    public boolean isRelative() {
        return window != null;
    }
}
