package com.deploypilot.engine.event;

import java.util.UUID;

/** Iteration cap reached without a terminal state; the run itself is untouched. */
public record PollTimeout(UUID runId) implements RunEvent {

    @Override
    public String type() { return "poll_timeout"; }
}
