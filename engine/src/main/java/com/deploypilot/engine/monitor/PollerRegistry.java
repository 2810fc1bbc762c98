package com.deploypilot.engine.monitor;

import com.deploypilot.engine.service.ExecutionService;
import com.deploypilot.engine.service.PollTarget;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the background poll loops of this instance, one per run at most.
 *
 * start, cancel and isPolling are synchronized on the registry, so two
 * callers can never both start a poller for the same run. A handle stays
 * registered until its loop has actually returned, also after a cancel, so
 * a restart cannot overlap with a loop that is still winding down and about
 * to release the lease. On shutdown every running loop is interrupted.
 */
@Component
public class PollerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PollerRegistry.class);

    public enum StartResult { STARTED, ALREADY_POLLING, NOT_POLLABLE }

    private record Handle(FutureTask<PollOutcome> task, AtomicBoolean token) {}

    private final Map<UUID, Handle> pollers = new HashMap<>();

    private final StatusPoller     poller;
    private final ExecutionService executionService;
    private final ExecutorService  pool;

    public PollerRegistry(StatusPoller poller, ExecutionService executionService, MonitorSettings settings) {
        this.poller           = poller;
        this.executionService = executionService;
        this.pool             = Executors.newFixedThreadPool(settings.maxConcurrentPollers(),
                new CustomizableThreadFactory("run-poller-"));
    }

    public synchronized StartResult start(UUID runId) {
        if (pollers.containsKey(runId)) {
            return StartResult.ALREADY_POLLING;
        }
        PollTarget target = executionService.pollTarget(runId);
        if (!target.pollable()) {
            return StartResult.NOT_POLLABLE;
        }

        // Whoever flips the token first owns removing the handle: the loop when
        // it got to run, done() when the task was cancelled before it started.
        AtomicBoolean claimed = new AtomicBoolean();
        FutureTask<PollOutcome> task = new FutureTask<>(() -> {
            if (!claimed.compareAndSet(false, true)) return PollOutcome.CANCELLED;
            try {
                return run(runId);
            } finally {
                finished(runId, claimed);
            }
        }) {
            @Override
            protected void done() {
                if (isCancelled() && claimed.compareAndSet(false, true)) {
                    finished(runId, claimed);
                }
            }
        };
        pollers.put(runId, new Handle(task, claimed));
        pool.execute(task);
        log.info("Poller started for execution {}", runId);
        return StartResult.STARTED;
    }

    /**
     * Interrupt the poller of {@code runId}. It stays registered until its
     * loop returns.
     *
     * @return true if a running poller was asked to stop
     */
    public synchronized boolean cancel(UUID runId) {
        Handle handle = pollers.get(runId);
        if (handle == null || !handle.task().cancel(true)) return false;
        log.info("Poller cancelled for execution {}", runId);
        return true;
    }

    public synchronized boolean isPolling(UUID runId) {
        return pollers.containsKey(runId);
    }

    public synchronized int activeCount() {
        return pollers.size();
    }

    private PollOutcome run(UUID runId) {
        try {
            PollOutcome outcome = poller.poll(runId);
            log.info("Poller for execution {} ended: {}", runId, outcome);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Poller for execution {} failed: {}", runId, e.getMessage(), e);
            return PollOutcome.ERROR;
        }
    }

    private synchronized void finished(UUID runId, AtomicBoolean token) {
        Handle handle = pollers.get(runId);
        if (handle != null && handle.token() == token) {
            pollers.remove(runId);
        }
    }

    @PreDestroy
    public void shutdown() {
        List<Handle> running;
        synchronized (this) {
            running = new ArrayList<>(pollers.values());
            pollers.clear();
        }
        running.forEach(handle -> handle.task().cancel(true));
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Poller pool did not terminate within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
