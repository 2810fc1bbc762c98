package com.deploypilot.engine.service;

import com.deploypilot.engine.retry.RetryOptions;

public record RollbackCommand(String reason, RetryOptions retryOptions, boolean monitor) {

    public RollbackCommand {
        if (retryOptions == null) retryOptions = RetryOptions.defaults();
    }
}
