package com.reprise.exception;

import lombok.Getter;

/**
 * A victim could not be removed. The sweep that hit it moves on and the entry is retried next cycle.
 */
@Getter
public class EvictionFailureException extends CacheException {

    private final String entryId;

    public EvictionFailureException(String entryId, Throwable cause) {
        super("Failed to evict cache entry " + entryId, cause);
        this.entryId = entryId;
    }
}
