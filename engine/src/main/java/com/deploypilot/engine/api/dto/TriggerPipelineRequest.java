package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.model.TriggerType;
import com.deploypilot.engine.retry.RetryOptions;
import com.deploypilot.engine.service.TriggerCommand;

/**
 * Request body for POST /pipelines/{id}/trigger. Every field is optional:
 * branch defaults to the pipeline's default branch, retry to 3 retries,
 * monitor to true.
 */
public record TriggerPipelineRequest(String branch,
                                     TriggerType triggerType,
                                     Boolean retry,
                                     Integer maxRetries,
                                     Boolean monitor) {

    public static TriggerPipelineRequest empty() {
        return new TriggerPipelineRequest(null, null, null, null, null);
    }

    public TriggerCommand toCommand() {
        return new TriggerCommand(branch, triggerType, retryOptions(retry, maxRetries),
                monitor == null || monitor);
    }

    static RetryOptions retryOptions(Boolean retry, Integer maxRetries) {
        return new RetryOptions(retry == null || retry,
                maxRetries == null ? RetryOptions.DEFAULT_MAX_RETRIES : maxRetries);
    }
}
