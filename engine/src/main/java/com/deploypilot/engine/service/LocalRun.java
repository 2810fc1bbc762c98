package com.deploypilot.engine.service;

import java.util.UUID;

/** A LOCAL run opened for a sandbox dry run, with the inputs the runner needs. */
public record LocalRun(UUID runId, UUID pipelineId, int pipelineVersion, String definitionYaml, String sourceUrl) {}
