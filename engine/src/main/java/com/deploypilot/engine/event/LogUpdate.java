package com.deploypilot.engine.event;

import com.deploypilot.engine.model.PipelineStatus;

import java.util.List;
import java.util.UUID;

/** Steps that are new or changed state since the previous fetch. */
public record LogUpdate(UUID runId, List<StepSnapshot> steps, PipelineStatus overallStatus) implements RunEvent {

    public LogUpdate {
        steps = List.copyOf(steps);
    }

    @Override
    public String type() { return "log_update"; }
}
