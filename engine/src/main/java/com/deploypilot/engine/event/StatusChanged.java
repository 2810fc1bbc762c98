package com.deploypilot.engine.event;

import com.deploypilot.engine.model.PipelineStatus;

import java.util.UUID;

/** Overall run status moved; {@code previousStatus} is null on the baseline event. */
public record StatusChanged(UUID runId, PipelineStatus status, PipelineStatus previousStatus) implements RunEvent {

    @Override
    public String type() { return "status_changed"; }
}
