package com.deploypilot.engine.service;

import com.deploypilot.engine.model.ExecutionKind;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.remote.dto.TriggerResult;
import com.deploypilot.engine.repository.ExecutionRunRepository;
import com.deploypilot.engine.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Stores a remote run once the backend has accepted the trigger.
 *
 * The remote call happens before this transaction opens, so no database
 * connection is held across retries and backoff waits.
 */
@Component
public class TriggerRecorder {

    private static final Logger log = LoggerFactory.getLogger(TriggerRecorder.class);

    private final ExecutionRunRepository    runRepo;
    private final PipelineRepository        pipelineRepo;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    public TriggerRecorder(ExecutionRunRepository runRepo,
                           PipelineRepository pipelineRepo,
                           ApplicationEventPublisher events,
                           Clock clock) {
        this.runRepo      = runRepo;
        this.pipelineRepo = pipelineRepo;
        this.events       = events;
        this.clock        = clock;
    }

    /**
     * Persist a BUILDING run for {@code started}, mirror it onto the pipeline
     * and announce it. A poller, when requested, starts after commit.
     */
    @Transactional
    public ExecutionRun recordStarted(StartedTrigger started) {
        Instant now = clock.instant();
        TriggerResult result = started.result();

        ExecutionRun run = new ExecutionRun(started.pipelineId(), started.pipelineVersion(),
                ExecutionKind.REMOTE, started.triggerType(), now);
        run.setRemoteIdentifiers(result.runUuid(), result.buildNumber(),
                result.commitHash() != null ? result.commitHash() : started.requestedCommit());
        run.setBranch(started.branch());
        run.setTriggerAttempts(started.attempts());
        if (started.previousExecutionId() != null) {
            run.markAsRollbackOf(started.previousExecutionId(), started.rollbackReason());
        }
        run = runRepo.save(run);

        ExecutionRun saved = run;
        pipelineRepo.findById(started.pipelineId()).ifPresent(pipeline -> {
            pipeline.setStatus(saved.getStatus());
            pipeline.setLastExecutionAt(now);
            pipelineRepo.save(pipeline);
        });

        log.info("Execution {} started for pipeline {} (remote build #{}, {} attempt(s))",
                run.getId(), started.pipelineId(), result.buildNumber(), started.attempts());

        events.publishEvent(new ExecutionStartedEvent(run.getId(), started.pipelineId(), started.monitor()));
        return run;
    }
}
