package com.reprise.entity;

import com.reprise.repository.converter.VectorConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnTransformer;

import java.time.Instant;

/**
 * JPA entity for the reprise_vectors table.
 * One row per cache entry that has an embedding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "reprise_vectors")
public class VectorRecordEntity {

    /**
     * Cache entry id.
     */
    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Convert(converter = VectorConverter.class)
    @ColumnTransformer(write = "cast(? as vector)")
    @Column(name = "embedding", nullable = false, columnDefinition = "vector")
    private float[] embedding;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
