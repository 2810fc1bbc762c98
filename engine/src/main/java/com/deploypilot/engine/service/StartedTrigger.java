package com.deploypilot.engine.service;

import com.deploypilot.engine.model.TriggerType;
import com.deploypilot.engine.remote.dto.TriggerResult;

import java.util.UUID;

/**
 * A remote run the backend accepted, waiting to be stored.
 * {@code requestedCommit} is the commit a rollback asked for; the backend's
 * own commit hash wins when it reports one.
 */
public record StartedTrigger(
        UUID          pipelineId,
        int           pipelineVersion,
        TriggerType   triggerType,
        String        branch,
        String        requestedCommit,
        TriggerResult result,
        int           attempts,
        boolean       monitor,
        UUID          previousExecutionId,
        String        rollbackReason
) {}
