package com.deploypilot.engine.service;

import java.util.UUID;

/**
 * Published inside the transaction that stores a live remote run;
 * listeners see it only after that transaction commits.
 */
public record ExecutionStartedEvent(UUID runId, UUID pipelineId, boolean monitor) {}
