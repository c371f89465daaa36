package com.reprise.model;

/**
 * Why an entry left the cache. Stats keep capacity pressure apart from staleness.
 */
public enum EvictionReason {
    CAPACITY,
    EXPIRED,
    INVALIDATED
}
