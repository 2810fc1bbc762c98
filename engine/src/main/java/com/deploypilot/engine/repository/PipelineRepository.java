package com.deploypilot.engine.repository;

import com.deploypilot.engine.model.Pipeline;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the pipelines table.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, UUID> {

    /**
     * The active pipeline of a repository, row-locked so that two concurrent
     * "create active pipeline" calls serialise on the deactivation step.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Pipeline> findByRepositoryKeyAndActiveTrue(String repositoryKey);
}
