package com.deploypilot.engine.repository;

import com.deploypilot.engine.model.ExecutionKind;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.model.PipelineStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + poller queries for the execution_runs table.
 */
public interface ExecutionRunRepository extends JpaRepository<ExecutionRun, UUID> {

    /** Run history of a pipeline, newest first. */
    List<ExecutionRun> findByPipelineIdOrderByStartedAtDesc(UUID pipelineId);

    /** Latest run of a pipeline; its status is what the pipeline mirrors. */
    Optional<ExecutionRun> findFirstByPipelineIdOrderByStartedAtDesc(UUID pipelineId);

    /**
     * Most recent run of a pipeline in the given status, with a known commit,
     * that started before {@code before}. Used to find the commit a rollback
     * re-deploys.
     */
    Optional<ExecutionRun> findFirstByPipelineIdAndStatusAndRemoteCommitHashIsNotNullAndStartedAtBeforeOrderByStartedAtDesc(
            UUID pipelineId, PipelineStatus status, Instant before);

    /**
     * Live runs of {@code kind} whose poll lease lapsed without being
     * released: their poller died with its instance. A released lease is
     * NULL, so runs nobody asked to monitor are not picked up.
     */
    @Query("""
            SELECT r FROM ExecutionRun r
             WHERE r.kind = :kind
               AND r.status IN :statuses
               AND r.remoteRunUuid IS NOT NULL
               AND r.pollLeaseOwner IS NOT NULL
               AND r.pollLeaseExpiresAt < :now
             ORDER BY r.startedAt
            """)
    List<ExecutionRun> findOrphanedRuns(@Param("kind") ExecutionKind kind,
                                        @Param("statuses") Collection<PipelineStatus> statuses,
                                        @Param("now") Instant now);

    /**
     * Claim (or renew) the poll lease of a run.
     *
     * Single conditional UPDATE, so two instances racing for the same run
     * cannot both get a row count of 1. The lease is free when nobody holds
     * it, when it expired, or when {@code owner} already holds it (renewal).
     *
     * @return 1 if the lease is now held by {@code owner}, 0 otherwise
     */
    @Modifying
    @Query("""
            UPDATE ExecutionRun r
               SET r.pollLeaseOwner = :owner, r.pollLeaseExpiresAt = :expiresAt
             WHERE r.id = :id
               AND (r.pollLeaseOwner IS NULL
                    OR r.pollLeaseOwner = :owner
                    OR r.pollLeaseExpiresAt < :now)
            """)
    int claimPollLease(@Param("id") UUID id,
                       @Param("owner") String owner,
                       @Param("expiresAt") Instant expiresAt,
                       @Param("now") Instant now);

    @Modifying
    @Query("""
            UPDATE ExecutionRun r
               SET r.pollLeaseOwner = NULL, r.pollLeaseExpiresAt = NULL
             WHERE r.id = :id AND r.pollLeaseOwner = :owner
            """)
    int releasePollLease(@Param("id") UUID id, @Param("owner") String owner);
}
