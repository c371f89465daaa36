package com.reprise.service.embedding;

import com.reprise.exception.EmbeddingException;

/**
 * Turns free text into fixed-length vectors.
 * Implementations can be remote (OpenAI-compatible endpoints) or decorators around one.
 */
public interface EmbeddingProvider {

    /**
     * Generate embedding vector for text.
     *
     * @param text input text
     * @return embedding vector of {@link #dimensions()} floats
     * @throws EmbeddingException on provider outage or malformed response
     */
    float[] embed(String text);

    /**
     * Get embedding dimensions.
     *
     * @return number of dimensions in output vector
     */
    int dimensions();

    /**
     * Get model name/identifier.
     *
     * @return model name
     */
    String modelName();
}
