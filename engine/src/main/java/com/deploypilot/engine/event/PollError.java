package com.deploypilot.engine.event;

import java.util.UUID;

public record PollError(UUID runId, String error) implements RunEvent {

    @Override
    public String type() { return "poll_error"; }
}
