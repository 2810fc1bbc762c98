package com.deploypilot.engine.service;

import com.deploypilot.engine.model.*;
import com.deploypilot.engine.remote.dto.RemoteRunRef;
import com.deploypilot.engine.remote.dto.TriggerRequest;
import com.deploypilot.engine.repository.ExecutionRunRepository;
import com.deploypilot.engine.repository.PipelineRepository;
import com.deploypilot.engine.retry.RetryOptions;
import com.deploypilot.engine.retry.RetryingTrigger;
import com.deploypilot.engine.retry.TriggerExhaustedException;
import com.deploypilot.engine.sandbox.SandboxRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Execution run lifecycle: remote triggers and rollbacks, local dry-run
 * bookkeeping, and the small transactional writes the status poller makes.
 *
 * Every status change goes through {@link ExecutionStateMachine}. The
 * pipeline row mirrors the status of its latest run only, so a late poll
 * result for an older run never overwrites a newer one.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    private static final Set<PipelineStatus> LIVE_STATUSES =
            EnumSet.of(PipelineStatus.BUILDING, PipelineStatus.TESTING, PipelineStatus.DEPLOYING);

    private final PipelineRepository        pipelineRepo;
    private final ExecutionRunRepository    runRepo;
    private final RetryingTrigger           retryingTrigger;
    private final ExecutionAuditWriter      auditWriter;
    private final TriggerRecorder           triggerRecorder;
    private final Clock                     clock;

    public ExecutionService(PipelineRepository pipelineRepo,
                            ExecutionRunRepository runRepo,
                            RetryingTrigger retryingTrigger,
                            ExecutionAuditWriter auditWriter,
                            TriggerRecorder triggerRecorder,
                            Clock clock) {
        this.pipelineRepo    = pipelineRepo;
        this.runRepo         = runRepo;
        this.retryingTrigger = retryingTrigger;
        this.auditWriter     = auditWriter;
        this.triggerRecorder = triggerRecorder;
        this.clock           = clock;
    }

    // ------------------------------------------------------------------
    // Remote trigger / rollback
    // ------------------------------------------------------------------

    /**
     * Start the pipeline on the remote CI backend.
     *
     * Not transactional: the pipeline is read, the remote call and its
     * retries run with no connection held, and the outcome is stored in a
     * transaction of its own. On success a BUILDING run is stored and, when
     * requested, a poller is started after commit. When every attempt fails
     * the failure is recorded as a terminal FAILED run and the exception is
     * rethrown carrying that run's id.
     *
     * @throws TriggerExhaustedException when the trigger could not be started
     */
    public ExecutionRun trigger(UUID pipelineId, TriggerCommand command) {
        Pipeline pipeline = requirePipeline(pipelineId);
        String branch = hasText(command.branch()) ? command.branch() : pipeline.getDefaultBranch();

        TriggerRequest request = new TriggerRequest(
                pipeline.getRemoteWorkspace(), pipeline.getRemoteRepoSlug(), branch);
        return start(pipeline, request, command.triggerType(), command.retryOptions(),
                command.monitor(), null, null);
    }

    /**
     * Re-deploy the commit of the most recent successful run that started
     * before {@code runId}. The new run points back at {@code runId}; the
     * superseded run itself is left untouched. Transaction handling is the
     * same as for {@link #trigger}.
     *
     * @throws NoRollbackTargetException when no earlier successful run has a known commit
     */
    public ExecutionRun rollback(UUID runId, RollbackCommand command) {
        ExecutionRun superseded = get(runId);
        ExecutionRun target = runRepo
                .findFirstByPipelineIdAndStatusAndRemoteCommitHashIsNotNullAndStartedAtBeforeOrderByStartedAtDesc(
                        superseded.getPipelineId(), PipelineStatus.SUCCESS, superseded.getStartedAt())
                .orElseThrow(() -> new NoRollbackTargetException(runId));

        Pipeline pipeline = requirePipeline(superseded.getPipelineId());
        String branch = hasText(target.getBranch()) ? target.getBranch() : pipeline.getDefaultBranch();

        log.info("Rolling back execution {} to commit {} of execution {}",
                runId, target.getRemoteCommitHash(), target.getId());

        TriggerRequest request = new TriggerRequest(pipeline.getRemoteWorkspace(),
                pipeline.getRemoteRepoSlug(), branch, target.getRemoteCommitHash());
        return start(pipeline, request, TriggerType.MANUAL, command.retryOptions(),
                command.monitor(), runId, command.reason());
    }

    private ExecutionRun start(Pipeline pipeline, TriggerRequest request, TriggerType triggerType,
                               RetryOptions retryOptions, boolean monitor,
                               UUID supersededRunId, String rollbackReason) {
        RetryingTrigger.Outcome outcome;
        try {
            outcome = retryingTrigger.trigger(request, retryOptions);
        } catch (TriggerExhaustedException e) {
            UUID failedRunId = auditWriter.recordFailedTrigger(new FailedTrigger(
                    pipeline.getId(), pipeline.getVersion(), triggerType, request.branch(),
                    e.attempts(), e.lastError(), supersededRunId, rollbackReason));
            throw e.recordedAs(failedRunId);
        }

        return triggerRecorder.recordStarted(new StartedTrigger(
                pipeline.getId(), pipeline.getVersion(), triggerType, request.branch(), request.commitHash(),
                outcome.result(), outcome.attempts(), monitor, supersededRunId, rollbackReason));
    }

    // ------------------------------------------------------------------
    // Local dry runs
    // ------------------------------------------------------------------

    /** Record the start of a sandbox dry run as a BUILDING LOCAL run. */
    @Transactional
    public LocalRun openLocalRun(UUID pipelineId) {
        Pipeline pipeline = requirePipeline(pipelineId);
        ExecutionRun run = runRepo.save(new ExecutionRun(
                pipelineId, pipeline.getVersion(), ExecutionKind.LOCAL, TriggerType.MANUAL, clock.instant()));

        pipeline.setStatus(run.getStatus());
        pipeline.setLastExecutionAt(clock.instant());
        pipelineRepo.save(pipeline);

        return new LocalRun(run.getId(), pipelineId, pipeline.getVersion(),
                pipeline.getDefinitionYaml(), pipeline.getSourceUrl());
    }

    /**
     * Store the transcript and outcome of a dry run. The pipeline keeps the
     * transcript as its latest test output.
     */
    @Transactional
    public ExecutionRun completeLocalRun(UUID runId, SandboxRunResult result) {
        ExecutionRun run = get(runId);
        Instant now = clock.instant();

        run.setLogs(result.combinedOutput());
        run.setErrorMessage(result.error());
        ExecutionStateMachine.transition(run, result.success() ? PipelineStatus.SUCCESS : PipelineStatus.FAILED, now);
        run = runRepo.save(run);

        Pipeline pipeline = requirePipeline(run.getPipelineId());
        pipeline.setTestOutput(result.combinedOutput());
        pipeline.setErrorMessage(result.error());
        if (isLatest(run)) {
            pipeline.setStatus(run.getStatus());
            pipeline.setLastExecutionAt(now);
        }
        pipelineRepo.save(pipeline);
        return run;
    }

    // ------------------------------------------------------------------
    // Poller writes
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public PollTarget pollTarget(UUID runId) {
        ExecutionRun run = get(runId);
        RemoteRunRef remote = null;
        if (run.getRemoteRunUuid() != null) {
            Pipeline pipeline = requirePipeline(run.getPipelineId());
            remote = new RemoteRunRef(pipeline.getRemoteWorkspace(), pipeline.getRemoteRepoSlug(),
                    run.getRemoteRunUuid());
        }
        return new PollTarget(run.getId(), run.getPipelineId(), run.getKind(), run.getStatus(), remote);
    }

    /**
     * Persist an intermediate status.
     *
     * @return the status the run had before the call
     */
    @Transactional
    public PipelineStatus recordStatus(UUID runId, PipelineStatus status) {
        if (status.isTerminal()) {
            throw new IllegalArgumentException("Terminal status " + status + " must be recorded through completeRun");
        }
        ExecutionRun run = get(runId);
        PipelineStatus previous = run.getStatus();
        if (ExecutionStateMachine.transition(run, status, clock.instant())) {
            runRepo.save(run);
            mirrorStatus(run, null);
            log.info("Execution {} {} -> {}", runId, previous, status);
        }
        return previous;
    }

    /**
     * Persist the terminal outcome of a remote run: status, transcript,
     * completion time and duration in one transaction. Repeating the call
     * with the same status changes nothing.
     */
    @Transactional
    public ExecutionRun completeRun(UUID runId, PipelineStatus terminal, String logs,
                                    Instant completedOn, Long durationSeconds) {
        ExecutionRun run = get(runId);
        if (run.getStatus() == terminal) {
            return run;
        }
        run.setLogs(logs);
        ExecutionStateMachine.complete(run, terminal, completedOn, durationSeconds, clock.instant());
        run = runRepo.save(run);
        mirrorStatus(run, run.getCompletedAt());
        log.info("Execution {} completed with {} after {}s", runId, terminal, run.getDurationSeconds());
        return run;
    }

    /** Remember why polling stopped. The run status is not touched. */
    @Transactional
    public void recordPollError(UUID runId, String error) {
        ExecutionRun run = get(runId);
        run.setErrorMessage(error);
        runRepo.save(run);
    }

    @Transactional
    public boolean claimPollLease(UUID runId, String owner, Duration ttl) {
        Instant now = clock.instant();
        return runRepo.claimPollLease(runId, owner, now.plus(ttl), now) == 1;
    }

    @Transactional
    public void releasePollLease(UUID runId, String owner) {
        runRepo.releasePollLease(runId, owner);
    }

    /** Ids of live remote runs whose poller stopped without releasing its lease. */
    @Transactional(readOnly = true)
    public List<UUID> orphanedRuns() {
        return runRepo.findOrphanedRuns(ExecutionKind.REMOTE, LIVE_STATUSES, clock.instant()).stream()
                .map(ExecutionRun::getId)
                .toList();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public ExecutionRun get(UUID runId) {
        return runRepo.findById(runId)
                .orElseThrow(() -> new ExecutionNotFoundException(runId));
    }

    /** Run history of a pipeline, newest first. */
    @Transactional(readOnly = true)
    public List<ExecutionRun> history(UUID pipelineId) {
        requirePipeline(pipelineId);
        return runRepo.findByPipelineIdOrderByStartedAtDesc(pipelineId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Pipeline requirePipeline(UUID pipelineId) {
        return pipelineRepo.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    private void mirrorStatus(ExecutionRun run, Instant lastExecutionAt) {
        if (!isLatest(run)) {
            log.debug("Execution {} is not the latest run of pipeline {}; pipeline status left as is",
                    run.getId(), run.getPipelineId());
            return;
        }
        pipelineRepo.findById(run.getPipelineId()).ifPresent(pipeline -> {
            pipeline.setStatus(run.getStatus());
            if (lastExecutionAt != null) pipeline.setLastExecutionAt(lastExecutionAt);
            pipelineRepo.save(pipeline);
        });
    }

    private boolean isLatest(ExecutionRun run) {
        return runRepo.findFirstByPipelineIdOrderByStartedAtDesc(run.getPipelineId())
                .map(latest -> latest.getId().equals(run.getId()))
                .orElse(true);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
