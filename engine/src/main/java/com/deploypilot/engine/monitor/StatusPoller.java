package com.deploypilot.engine.monitor;

import com.deploypilot.engine.event.*;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.model.PipelineStatus;
import com.deploypilot.engine.remote.RemoteCiClient;
import com.deploypilot.engine.remote.dto.RemoteRunStatus;
import com.deploypilot.engine.remote.dto.RemoteStepStatus;
import com.deploypilot.engine.retry.Sleeper;
import com.deploypilot.engine.service.ExecutionService;
import com.deploypilot.engine.service.PollTarget;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Follows one remote run until it finishes, turning each fetched snapshot
 * into run events.
 *
 * Per fetch, in this order:
 * <ol>
 *   <li>{@code status_changed} on the first fetch and whenever the mapped status moves
 *       (persisted before the event is published);</li>
 *   <li>{@code log_update} on the first fetch (all steps) and whenever a step is new
 *       or changed state;</li>
 *   <li>{@code run_complete} once the remote state is terminal; the loop then exits
 *       without fetching again.</li>
 * </ol>
 *
 * The loop holds a DB lease on the run for as long as it runs, so two
 * instances never poll the same run. It ends with {@code poll_timeout}
 * after {@code maxIterations} fetches and with {@code poll_error} when
 * fetching fails; neither touches the run status.
 *
 * Counter: {@code deploypilot.monitor.polls{outcome}}
 */
@Component
public class StatusPoller {

    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final ExecutionService executionService;
    private final RemoteCiClient   client;
    private final RunEventBus      eventBus;
    private final Sleeper          sleeper;
    private final MonitorSettings  settings;
    private final MeterRegistry    meterRegistry;
    private final String           instanceId;

    public StatusPoller(ExecutionService executionService,
                        RemoteCiClient client,
                        RunEventBus eventBus,
                        Sleeper sleeper,
                        MonitorSettings settings,
                        MeterRegistry meterRegistry,
                        @Value("${deploypilot.instance-id:${random.uuid}}") String instanceId) {
        this.executionService = executionService;
        this.client           = client;
        this.eventBus         = eventBus;
        this.sleeper          = sleeper;
        this.settings         = settings;
        this.meterRegistry    = meterRegistry;
        this.instanceId       = instanceId;
    }

    /**
     * Poll the run on the calling thread until it completes, times out,
     * fails or the thread is interrupted.
     */
    public PollOutcome poll(UUID runId) {
        PollTarget target = executionService.pollTarget(runId);
        if (!target.pollable()) {
            log.info("Execution {} is not pollable (kind={}, status={})", runId, target.kind(), target.status());
            return count(PollOutcome.NOT_POLLABLE);
        }
        if (!executionService.claimPollLease(runId, instanceId, settings.leaseTtl())) {
            log.info("Execution {} is already polled by another instance", runId);
            return count(PollOutcome.LEASE_UNAVAILABLE);
        }

        MDC.put("runId",      runId.toString());
        MDC.put("pipelineId", target.pipelineId().toString());
        try {
            return count(loop(target));
        } catch (RuntimeException e) {
            log.error("Polling of execution {} aborted: {}", runId, e.getMessage(), e);
            String error = "Polling aborted: " + e.getMessage();
            eventBus.publish(target.pipelineId(), new PollError(runId, error));
            recordPollError(runId, error);
            return count(PollOutcome.ERROR);
        } finally {
            releaseLease(runId);
            MDC.remove("pipelineId");
            MDC.remove("runId");
        }
    }

    private PollOutcome loop(PollTarget target) {
        UUID runId = target.runId();
        UUID pipelineId = target.pipelineId();
        StepDiffer differ = new StepDiffer();
        PipelineStatus lastStatus = target.status();
        boolean firstFetch = true;
        int consecutiveErrors = 0;

        for (int iteration = 1; iteration <= settings.maxIterations(); iteration++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Polling of execution {} cancelled", runId);
                return PollOutcome.CANCELLED;
            }
            if (iteration > 1 && !executionService.claimPollLease(runId, instanceId, settings.leaseTtl())) {
                log.warn("Lost poll lease of execution {} at iteration {}", runId, iteration);
                return PollOutcome.LEASE_UNAVAILABLE;
            }

            RemoteRunStatus snapshot;
            try {
                snapshot = client.fetchStatus(target.remote());
                consecutiveErrors = 0;
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Polling of execution {} cancelled during fetch", runId);
                    return PollOutcome.CANCELLED;
                }
                consecutiveErrors++;
                if (consecutiveErrors >= settings.maxConsecutiveFetchErrors()) {
                    String error = "Failed to fetch run status: " + e.getMessage();
                    log.error("Polling of execution {} stopped after {} failed fetch(es): {}",
                            runId, consecutiveErrors, e.getMessage());
                    recordPollError(runId, error);
                    eventBus.publish(pipelineId, new PollError(runId, error));
                    return PollOutcome.FETCH_FAILED;
                }
                log.warn("Fetch {}/{} for execution {} failed: {}",
                        consecutiveErrors, settings.maxConsecutiveFetchErrors(), runId, e.getMessage());
                if (!pause(iteration)) return PollOutcome.CANCELLED;
                continue;
            }

            Optional<PipelineStatus> mapped = RemoteStateMapping.toInternal(snapshot.state());
            if (mapped.isEmpty()) {
                log.warn("Execution {} reports unknown remote state '{}'", runId, snapshot.state());
            }
            PipelineStatus current = mapped.orElse(lastStatus);
            boolean statusMoved = mapped.isPresent() && (firstFetch || current != lastStatus);
            List<RemoteStepStatus> changedSteps = differ.diff(snapshot.steps());
            boolean stepsMoved = firstFetch || !changedSteps.isEmpty();

            if (RemoteStateMapping.isTerminal(snapshot.state())) {
                ExecutionRun run = executionService.completeRun(runId, current, transcript(snapshot.steps()),
                        snapshot.completedOn(), snapshot.durationSeconds());
                if (statusMoved) {
                    eventBus.publish(pipelineId, new StatusChanged(runId, current, lastStatus));
                }
                if (stepsMoved) {
                    eventBus.publish(pipelineId, new LogUpdate(runId, snapshots(changedSteps), current));
                }
                eventBus.publish(pipelineId, new RunComplete(runId, run.getStatus(), run.getDurationSeconds()));
                log.info("Execution {} finished remotely with {} after {} fetch(es)", runId, snapshot.state(), iteration);
                return PollOutcome.COMPLETED;
            }

            if (statusMoved) {
                PipelineStatus previous = executionService.recordStatus(runId, current);
                eventBus.publish(pipelineId, new StatusChanged(runId, current, previous));
                lastStatus = current;
            }
            if (stepsMoved) {
                eventBus.publish(pipelineId, new LogUpdate(runId, snapshots(changedSteps), current));
            }
            firstFetch = false;

            if (!pause(iteration)) return PollOutcome.CANCELLED;
        }

        log.warn("Polling of execution {} timed out after {} fetch(es)", runId, settings.maxIterations());
        eventBus.publish(pipelineId, new PollTimeout(runId));
        return PollOutcome.TIMED_OUT;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Wait for the next iteration; never after the last one. False when interrupted. */
    private boolean pause(int iteration) {
        if (iteration >= settings.maxIterations()) return true;
        try {
            sleeper.sleep(settings.interval());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<StepSnapshot> snapshots(List<RemoteStepStatus> steps) {
        return steps.stream()
                .map(s -> new StepSnapshot(s.name(), s.state(), s.durationSeconds(), preview(s.log())))
                .toList();
    }

    private String preview(String stepLog) {
        if (stepLog == null || stepLog.isEmpty()) return null;
        return stepLog.length() <= settings.logPreviewChars()
                ? stepLog
                : stepLog.substring(0, settings.logPreviewChars());
    }

    static String transcript(List<RemoteStepStatus> steps) {
        StringBuilder out = new StringBuilder();
        for (RemoteStepStatus step : steps) {
            out.append("=== ").append(step.name()).append(" ===\n");
            String stepLog = step.log();
            if (stepLog != null && !stepLog.isEmpty()) {
                out.append(stepLog);
                if (!stepLog.endsWith("\n")) out.append('\n');
            }
        }
        return out.toString();
    }

    private void recordPollError(UUID runId, String error) {
        try {
            executionService.recordPollError(runId, error);
        } catch (RuntimeException e) {
            log.warn("Could not persist poll error of execution {}: {}", runId, e.getMessage());
        }
    }

    private void releaseLease(UUID runId) {
        try {
            executionService.releasePollLease(runId, instanceId);
        } catch (RuntimeException e) {
            log.warn("Could not release poll lease of execution {}, it expires on its own: {}",
                    runId, e.getMessage());
        }
    }

    private PollOutcome count(PollOutcome outcome) {
        meterRegistry.counter("deploypilot.monitor.polls", "outcome", outcome.name().toLowerCase()).increment();
        return outcome;
    }
}
