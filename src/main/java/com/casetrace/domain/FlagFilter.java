package com.casetrace.domain;

/**
 * Mutually exclusive detection-flag selectors for a search.
 */
public enum FlagFilter {
    ALL,
    SIGMA,
    IOC,
    IOC_2PLUS,
    IOC_3PLUS,
    SIGMA_AND_IOC,
    /**
     * Only events an analyst tagged; requires the tagged id list
     */
    TAGGED
}
