package com.deploypilot.engine.retry;

import java.util.UUID;

/**
 * Every allowed trigger attempt failed (or one failed permanently).
 *
 * Carries the number of attempts actually made and the last error. Once
 * the failure has been recorded, {@code executionId} points at the
 * terminal FAILED run that documents it.
 */
public class TriggerExhaustedException extends RuntimeException {

    private final int  attempts;
    private final UUID executionId;

    public TriggerExhaustedException(int attempts, RuntimeException lastError) {
        this(attempts, lastError, null);
    }

    private TriggerExhaustedException(int attempts, Throwable lastError, UUID executionId) {
        super("Trigger failed after %d attempt(s): %s".formatted(attempts, lastError.getMessage()), lastError);
        this.attempts    = attempts;
        this.executionId = executionId;
    }

    public int  attempts()    { return attempts; }
    public UUID executionId() { return executionId; }

    /** Message of the last underlying error. */
    public String lastError() {
        return getCause().getMessage();
    }

    public TriggerExhaustedException recordedAs(UUID executionId) {
        return new TriggerExhaustedException(attempts, getCause(), executionId);
    }
}
