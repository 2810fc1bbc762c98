package com.deploypilot.engine.service;

import com.deploypilot.engine.model.ExecutionKind;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.model.ExecutionStateMachine;
import com.deploypilot.engine.model.PipelineStatus;
import com.deploypilot.engine.repository.ExecutionRunRepository;
import com.deploypilot.engine.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes audit records that must outlive any caller's transaction.
 *
 * REQUIRES_NEW commits the FAILED run on its own, so a caller that rolls
 * back (the exhaustion error is rethrown) never takes the record with it.
 * Lives in its own bean because the propagation setting only applies
 * through the Spring proxy.
 */
@Component
public class ExecutionAuditWriter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionAuditWriter.class);

    private final ExecutionRunRepository runRepo;
    private final PipelineRepository     pipelineRepo;
    private final Clock                  clock;

    public ExecutionAuditWriter(ExecutionRunRepository runRepo, PipelineRepository pipelineRepo, Clock clock) {
        this.runRepo      = runRepo;
        this.pipelineRepo = pipelineRepo;
        this.clock        = clock;
    }

    /**
     * Persist a terminal FAILED run for a trigger that never started a
     * remote run, and mirror FAILED onto the pipeline.
     *
     * @return id of the new run
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID recordFailedTrigger(FailedTrigger failure) {
        Instant now = clock.instant();

        ExecutionRun run = new ExecutionRun(failure.pipelineId(), failure.pipelineVersion(),
                ExecutionKind.REMOTE, failure.triggerType(), now);
        run.setBranch(failure.branch());
        run.setTriggerAttempts(failure.attempts());
        run.setErrorMessage(failure.lastError());
        if (failure.previousExecutionId() != null) {
            run.markAsRollbackOf(failure.previousExecutionId(), failure.rollbackReason());
        }
        run.setDurationSeconds(0L);
        ExecutionStateMachine.transition(run, PipelineStatus.FAILED, now);
        run = runRepo.save(run);

        pipelineRepo.findById(failure.pipelineId()).ifPresent(pipeline -> {
            pipeline.setStatus(PipelineStatus.FAILED);
            pipeline.setLastExecutionAt(now);
            pipelineRepo.save(pipeline);
        });

        log.error("Recorded failed trigger for pipeline {} as execution {} after {} attempt(s): {}",
                failure.pipelineId(), run.getId(), failure.attempts(), failure.lastError());
        return run.getId();
    }
}
