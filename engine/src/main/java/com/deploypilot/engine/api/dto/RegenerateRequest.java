package com.deploypilot.engine.api.dto;

/** Request body for PUT /pipelines/{id}/definition. */
public record RegenerateRequest(String definitionYaml) {}
