package com.deploypilot.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of run events to "rooms" keyed by pipeline.
 *
 * Any number of listeners may join a room; each published event is
 * delivered to all of them on the publishing thread. A listener that throws
 * is logged and skipped so it cannot stall the poller or other listeners.
 */
@Component
public class RunEventBus {

    private static final Logger log = LoggerFactory.getLogger(RunEventBus.class);

    private final Map<String, List<RunEventListener>> rooms = new ConcurrentHashMap<>();

    public static String roomFor(UUID pipelineId) {
        return "pipeline_" + pipelineId;
    }

    /** Join the pipeline's room. Closing the returned subscription leaves it. */
    public Subscription subscribe(UUID pipelineId, RunEventListener listener) {
        String room = roomFor(pipelineId);
        rooms.computeIfAbsent(room, r -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Listener joined room {}", room);
        return () -> leave(room, listener);
    }

    public void publish(UUID pipelineId, RunEvent event) {
        List<RunEventListener> listeners = rooms.get(roomFor(pipelineId));
        log.debug("Publishing {} for run {} to {} listener(s)",
                event.type(), event.runId(), listeners == null ? 0 : listeners.size());
        if (listeners == null) return;
        for (RunEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener in room {} failed on {}: {}",
                        roomFor(pipelineId), event.type(), e.getMessage(), e);
            }
        }
    }

    public int subscriberCount(UUID pipelineId) {
        List<RunEventListener> listeners = rooms.get(roomFor(pipelineId));
        return listeners == null ? 0 : listeners.size();
    }

    private void leave(String room, RunEventListener listener) {
        rooms.computeIfPresent(room, (r, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Handle for leaving a room. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
