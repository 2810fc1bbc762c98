package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.service.RollbackCommand;

/** Request body for POST /executions/{id}/rollback. */
public record RollbackRequest(String reason, Boolean retry, Integer maxRetries, Boolean monitor) {

    public static RollbackRequest empty() {
        return new RollbackRequest(null, null, null, null);
    }

    public RollbackCommand toCommand() {
        return new RollbackCommand(reason == null || reason.isBlank() ? "Manual rollback" : reason,
                TriggerPipelineRequest.retryOptions(retry, maxRetries),
                monitor == null || monitor);
    }
}
