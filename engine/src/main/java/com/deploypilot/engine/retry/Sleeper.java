package com.deploypilot.engine.retry;

import java.time.Duration;

/**
 * Blocking wait, pulled out so retry and poll loops can be tested without
 * real delays. Interruption is the cancellation signal.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
