package com.deploypilot.engine.remote.dto;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a remote run.
 *
 * {@code state} is already flattened: a completed run reports its result
 * (COMPLETED, FAILED, STOPPED or ERROR) instead of the generic COMPLETED.
 */
public record RemoteRunStatus(
        String                 state,
        List<RemoteStepStatus> steps,
        Instant                completedOn,
        Long                   durationSeconds
) {
    public RemoteRunStatus {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
