package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Victim selection rule used under capacity pressure. Exactly one policy is active at a time.
 */
public enum EvictionPolicy {
    LRU("lru"),
    LFU("lfu"),
    SEMANTIC_RELEVANCE("semantic-relevance"),
    HYBRID("hybrid");

    private final String value;

    EvictionPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EvictionPolicy fromValue(String value) {
        for (EvictionPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value) || policy.name().equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown eviction policy: " + value);
    }
}
