package com.reprise.exception;

import lombok.Getter;

/**
 * An external collaborator (embedding provider, vector index, durable store) failed or timed out.
 */
@Getter
public class CollaboratorUnavailableException extends CacheException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(collaborator + " unavailable: " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }
}
