package com.reprise.service.index;

import java.util.List;

/**
 * Nearest-neighbour search over query embeddings.
 *
 * Records are keyed by cache entry id. The index may lag the durable store; callers
 * must re-read every match before trusting it.
 */
public interface VectorIndex {

    /**
     * Up to {@code topK} matches, best first.
     */
    List<VectorMatch> query(float[] vector, int topK);

    /**
     * Insert or replace the vector stored under {@code id}.
     */
    void upsert(String id, float[] vector);

    /**
     * Remove {@code id}. Removing an unknown id is a no-op.
     */
    void remove(String id);

    /**
     * Number of indexed vectors.
     */
    long size();
}
