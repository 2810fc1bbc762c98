package com.deploypilot.engine.service;

import com.deploypilot.engine.model.ExecutionKind;
import com.deploypilot.engine.model.PipelineStatus;
import com.deploypilot.engine.remote.dto.RemoteRunRef;

import java.util.UUID;

/**
 * Detached view of a run with everything the poller needs, so the poll
 * loop never touches a managed entity outside a transaction.
 */
public record PollTarget(UUID runId, UUID pipelineId, ExecutionKind kind,
                         PipelineStatus status, RemoteRunRef remote) {

    /** Only live remote runs with a remote id can be polled. */
    public boolean pollable() {
        return kind == ExecutionKind.REMOTE && !status.isTerminal() && remote != null;
    }
}
