package com.deploypilot.engine.retry;

/**
 * Caller-supplied retry behaviour for one trigger.
 *
 * @param retry      false makes the trigger single-shot
 * @param maxRetries retries after the first attempt; total attempts = maxRetries + 1
 */
public record RetryOptions(boolean retry, int maxRetries) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public RetryOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 (was " + maxRetries + ")");
        }
    }

    public static RetryOptions defaults() {
        return new RetryOptions(true, DEFAULT_MAX_RETRIES);
    }

    public static RetryOptions noRetry() {
        return new RetryOptions(false, 0);
    }

    /** Total number of attempts these options allow. */
    public int maxAttempts() {
        return retry ? maxRetries + 1 : 1;
    }
}
