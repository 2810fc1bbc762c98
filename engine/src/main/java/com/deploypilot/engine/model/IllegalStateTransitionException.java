package com.deploypilot.engine.model;

import java.util.UUID;

/**
 * Thrown when a caller tries to move an ExecutionRun out of a terminal
 * state, or into a state a run can never hold.
 */
public class IllegalStateTransitionException extends RuntimeException {

    private final UUID runId;
    private final PipelineStatus from;
    private final PipelineStatus to;

    public IllegalStateTransitionException(UUID runId, PipelineStatus from, PipelineStatus to) {
        super("Execution %s cannot move from %s to %s".formatted(runId, from, to));
        this.runId = runId;
        this.from  = from;
        this.to    = to;
    }

    public UUID           runId() { return runId; }
    public PipelineStatus from()  { return from; }
    public PipelineStatus to()    { return to; }
}
