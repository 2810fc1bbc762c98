package com.deploypilot.engine.monitor;

import com.deploypilot.engine.service.ExecutionStartedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts a poller for a freshly triggered run once the trigger transaction
 * has committed, so the poller always finds the run row.
 */
@Component
public class MonitorLauncher {

    private static final Logger log = LoggerFactory.getLogger(MonitorLauncher.class);

    private final PollerRegistry registry;

    public MonitorLauncher(PollerRegistry registry) {
        this.registry = registry;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onExecutionStarted(ExecutionStartedEvent event) {
        if (!event.monitor()) return;
        try {
            PollerRegistry.StartResult result = registry.start(event.runId());
            log.debug("Monitor request for execution {}: {}", event.runId(), result);
        } catch (RuntimeException e) {
            log.error("Could not start poller for execution {}: {}", event.runId(), e.getMessage(), e);
        }
    }
}
