package com.deploypilot.engine.event;

import java.util.UUID;

/**
 * Notification emitted while a run is monitored. {@link #type()} is the
 * wire name a transport should use for the event.
 */
public interface RunEvent {

    UUID runId();

    String type();
}
