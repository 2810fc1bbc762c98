package com.deploypilot.engine.retry;

import com.deploypilot.engine.remote.RemoteCiClient;
import com.deploypilot.engine.remote.RemoteCiException;
import com.deploypilot.engine.remote.TransientRemoteException;
import com.deploypilot.engine.remote.dto.TriggerRequest;
import com.deploypilot.engine.remote.dto.TriggerResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts a remote run with bounded exponential backoff.
 *
 * Attempt 1 runs immediately. After failed attempt n the caller waits
 * 2^n seconds, so maxRetries = 3 waits 2 s, 4 s and 8 s between the four
 * attempts. Only {@link TransientRemoteException} is retried; any other
 * {@link RemoteCiException} ends the loop at once.
 *
 * Counter: {@code deploypilot.trigger.attempts{outcome="success|transient|permanent"}}
 */
@Component
public class RetryingTrigger {

    private static final Logger log = LoggerFactory.getLogger(RetryingTrigger.class);

    private final RemoteCiClient client;
    private final Sleeper        sleeper;
    private final MeterRegistry  meterRegistry;

    public RetryingTrigger(RemoteCiClient client, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.client        = client;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return the started run together with the number of attempts it took
     * @throws TriggerExhaustedException when no attempt succeeded
     */
    public Outcome trigger(TriggerRequest request, RetryOptions options) {
        int maxAttempts = options.maxAttempts();
        RemoteCiException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                TriggerResult result = client.trigger(request);
                count("success");
                if (attempt > 1) {
                    log.info("Trigger of {}/{} succeeded on attempt {}/{}",
                            request.workspace(), request.repoSlug(), attempt, maxAttempts);
                }
                return new Outcome(result, attempt);
            } catch (TransientRemoteException e) {
                count("transient");
                lastError = e;
                log.warn("Trigger attempt {}/{} for {}/{} failed: {}",
                        attempt, maxAttempts, request.workspace(), request.repoSlug(), e.getMessage());
            } catch (RemoteCiException e) {
                count("permanent");
                log.error("Trigger of {}/{} failed permanently on attempt {}: {}",
                        request.workspace(), request.repoSlug(), attempt, e.getMessage());
                throw new TriggerExhaustedException(attempt, e);
            }

            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(backoff(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TriggerExhaustedException(attempt, lastError);
                }
            }
        }
        throw new TriggerExhaustedException(maxAttempts, lastError);
    }

    /** Wait after failed attempt {@code attempt} (1-based): 2^attempt seconds. */
    static Duration backoff(int attempt) {
        return Duration.ofSeconds(1L << attempt);
    }

    private void count(String outcome) {
        meterRegistry.counter("deploypilot.trigger.attempts", "outcome", outcome).increment();
    }

    /** A successful trigger and how many attempts it needed. */
    public record Outcome(TriggerResult result, int attempts) {}
}
