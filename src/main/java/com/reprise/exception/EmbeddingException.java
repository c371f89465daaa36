package com.reprise.exception;

/**
 * Embedding provider outage or malformed embedding response.
 */
public class EmbeddingException extends CollaboratorUnavailableException {

    private static final String COLLABORATOR = "embedding provider";

    public EmbeddingException(String message) {
        super(COLLABORATOR, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(COLLABORATOR, message, cause);
    }
}
