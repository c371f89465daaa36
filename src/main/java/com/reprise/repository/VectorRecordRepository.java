package com.reprise.repository;

import com.reprise.entity.VectorRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for entry embeddings with pgvector nearest-neighbour search.
 */
@Repository
public interface VectorRecordRepository extends JpaRepository<VectorRecordEntity, String> {

    /**
     * Nearest rows by cosine distance.
     * Uses pgvector's <=> operator; score is {@code 1 - distance}.
     */
    @Query(value = """
            SELECT id AS id,
                   1 - (embedding <=> cast(:embedding as vector)) AS score
            FROM reprise_vectors
            ORDER BY embedding <=> cast(:embedding as vector)
            LIMIT :limit
            """, nativeQuery = true)
    List<VectorMatchView> findNearest(
            @Param("embedding") String embedding, // PGvector format string
            @Param("limit") int limit
    );

    interface VectorMatchView {
        String getId();

        Double getScore();
    }
}
