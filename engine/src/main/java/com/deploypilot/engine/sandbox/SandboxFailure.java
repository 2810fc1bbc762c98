package com.deploypilot.engine.sandbox;

/** Why a sandbox run did not succeed. */
public enum SandboxFailure {
    CONFIG_INVALID,          // definition failed to parse or validate
    CLONE_FAILED,            // source tree could not be obtained
    ENVIRONMENT_UNAVAILABLE, // image/runtime could not be provisioned
    STEP_FAILED,             // a step's commands exited non-zero
    TIMEOUT                  // step or whole-run wall clock exceeded
}
