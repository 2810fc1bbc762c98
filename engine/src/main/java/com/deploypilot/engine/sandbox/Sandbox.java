package com.deploypilot.engine.sandbox;

import java.time.Duration;

/**
 * A provisioned, isolated execution environment for exactly one step.
 *
 * Closing destroys the environment; implementations must make close()
 * safe to call after a failed or timed-out execution.
 */
public interface Sandbox extends AutoCloseable {

    /**
     * Run a script that already exists in the working copy.
     *
     * @param scriptPath path of the script relative to the working copy root
     * @param timeout    wall-clock bound; exceeding it yields a timed-out result
     */
    CommandResult execute(String scriptPath, Duration timeout);

    @Override
    void close();
}
