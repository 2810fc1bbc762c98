package com.deploypilot.engine.model;

/**
 * Lifecycle states shared by a Pipeline (mirrored) and its ExecutionRuns.
 *
 * Happy path:
 *   PLANNED → BUILDING → TESTING → DEPLOYING → SUCCESS
 *
 * Any non-terminal state may jump straight to SUCCESS or FAILED.
 * PLANNED only ever applies to a pipeline that has not run since its
 * last (re)generation; runs start in BUILDING.
 */
public enum PipelineStatus {
    PLANNED,
    BUILDING,
    TESTING,
    DEPLOYING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
