package com.reprise.exception;

/**
 * Malformed request (missing request or query). Raised before anything reaches the store.
 */
public class CacheValidationException extends CacheException {

    public CacheValidationException(String message) {
        super(message);
    }
}
