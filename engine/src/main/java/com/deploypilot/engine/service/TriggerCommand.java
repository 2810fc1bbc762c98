package com.deploypilot.engine.service;

import com.deploypilot.engine.model.TriggerType;
import com.deploypilot.engine.retry.RetryOptions;

/**
 * Parameters of a remote trigger.
 *
 * @param branch       branch to build; null or blank means the pipeline's default branch
 * @param triggerType  who asked for the run
 * @param retryOptions retry policy of the trigger call
 * @param monitor      start a status poller once the run is recorded
 */
public record TriggerCommand(String branch, TriggerType triggerType, RetryOptions retryOptions, boolean monitor) {

    public TriggerCommand {
        if (triggerType == null)  triggerType  = TriggerType.MANUAL;
        if (retryOptions == null) retryOptions = RetryOptions.defaults();
    }

    public static TriggerCommand manual() {
        return new TriggerCommand(null, TriggerType.MANUAL, RetryOptions.defaults(), true);
    }
}
