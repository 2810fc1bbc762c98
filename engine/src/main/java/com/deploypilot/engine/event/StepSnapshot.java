package com.deploypilot.engine.event;

/**
 * One step as shown in a {@link LogUpdate}; the log is a truncated preview,
 * the full text only goes into the persisted transcript.
 */
public record StepSnapshot(String name, String state, Long durationSeconds, String logPreview) {}
