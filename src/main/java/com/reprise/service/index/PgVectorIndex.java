package com.reprise.service.index;

import com.reprise.entity.VectorRecordEntity;
import com.reprise.exception.CollaboratorUnavailableException;
import com.reprise.repository.VectorRecordRepository;
import com.reprise.repository.converter.VectorConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * Vector index backed by a pgvector table.
 */
@Slf4j
public class PgVectorIndex implements VectorIndex {

    private static final String COLLABORATOR = "vector index";

    private final VectorRecordRepository repository;

    public PgVectorIndex(VectorRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK) {
        if (vector == null || topK <= 0) {
            return List.of();
        }
        try {
            return repository.findNearest(VectorConverter.toVectorString(vector), topK).stream()
                    .map(view -> new VectorMatch(view.getId(), view.getScore() != null ? view.getScore() : 0.0))
                    .toList();
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "Nearest-neighbour query failed", e);
        }
    }

    @Override
    public void upsert(String id, float[] vector) {
        try {
            repository.save(VectorRecordEntity.builder()
                    .id(id)
                    .embedding(vector)
                    .build());
            log.debug("Indexed vector: id={}, dims={}", id, vector.length);
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "Upsert failed for " + id, e);
        }
    }

    @Override
    public void remove(String id) {
        try {
            if (repository.existsById(id)) {
                repository.deleteById(id);
            }
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "Remove failed for " + id, e);
        }
    }

    @Override
    public long size() {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "Count failed", e);
        }
    }
}
