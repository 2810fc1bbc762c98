package com.deploypilot.engine.model;

/** What caused an ExecutionRun to be created. */
public enum TriggerType {
    MANUAL,
    WEBHOOK,
    SCHEDULED
}
