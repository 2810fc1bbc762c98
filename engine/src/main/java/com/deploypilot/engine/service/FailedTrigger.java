package com.deploypilot.engine.service;

import com.deploypilot.engine.model.TriggerType;

import java.util.UUID;

/**
 * Everything needed to record an exhausted trigger as a terminal run.
 * {@code previousExecutionId} and {@code rollbackReason} are set when the
 * failed trigger was a rollback.
 */
public record FailedTrigger(
        UUID        pipelineId,
        int         pipelineVersion,
        TriggerType triggerType,
        String      branch,
        int         attempts,
        String      lastError,
        UUID        previousExecutionId,
        String      rollbackReason
) {}
