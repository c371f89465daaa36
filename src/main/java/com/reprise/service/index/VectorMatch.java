package com.reprise.service.index;

/**
 * A nearest-neighbour result. {@code score} is cosine similarity and only orders candidates.
 */
public record VectorMatch(String id, double score) {
}
