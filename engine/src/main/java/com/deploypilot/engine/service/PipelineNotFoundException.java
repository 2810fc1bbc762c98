package com.deploypilot.engine.service;

import java.util.UUID;

public class PipelineNotFoundException extends RuntimeException {

    public PipelineNotFoundException(UUID id) {
        super("Pipeline not found: " + id);
    }
}
