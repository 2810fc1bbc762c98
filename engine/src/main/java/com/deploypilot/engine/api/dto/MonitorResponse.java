package com.deploypilot.engine.api.dto;

import java.util.UUID;

/** Response body for POST and DELETE /executions/{id}/monitor. */
public record MonitorResponse(UUID executionId, boolean polling, String result) {}
