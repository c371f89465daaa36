package com.reprise.service.warming;

/**
 * Label of where warming queries come from.
 */
public enum WarmingMode {
    PREDICTIVE,
    PATTERN_BASED,
    SCHEDULED
}
