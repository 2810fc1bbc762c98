package com.deploypilot.engine.event;

import com.deploypilot.engine.model.PipelineStatus;

import java.util.UUID;

public record RunComplete(UUID runId, PipelineStatus status, Long durationSeconds) implements RunEvent {

    @Override
    public String type() { return "run_complete"; }
}
