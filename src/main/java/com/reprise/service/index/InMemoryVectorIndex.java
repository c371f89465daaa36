package com.reprise.service.index;

import com.reprise.service.similarity.CosineSimilarity;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force vector index held in memory. Used for tests and single-node deployments.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();

    @Override
    public List<VectorMatch> query(float[] vector, int topK) {
        if (vector == null || topK <= 0) {
            return List.of();
        }
        return vectors.entrySet().stream()
                .map(e -> new VectorMatch(e.getKey(), CosineSimilarity.cosine(vector, e.getValue())))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed()
                        .thenComparing(VectorMatch::id))
                .limit(topK)
                .toList();
    }

    @Override
    public void upsert(String id, float[] vector) {
        vectors.put(id, vector.clone());
    }

    @Override
    public void remove(String id) {
        vectors.remove(id);
    }

    @Override
    public long size() {
        return vectors.size();
    }
}
