package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.model.PipelineVersion;

import java.time.Instant;

public record PipelineVersionResponse(int version, String definitionYaml, Instant createdAt) {

    public static PipelineVersionResponse from(PipelineVersion v) {
        return new PipelineVersionResponse(v.getVersion(), v.getDefinitionYaml(), v.getCreatedAt());
    }
}
