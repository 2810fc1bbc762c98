package com.deploypilot.engine.model;

/**
 * Where an ExecutionRun executed.
 *
 * LOCAL  : sandbox dry run on this host, never polled
 * REMOTE : triggered on the remote CI backend, tracked by the status poller
 */
public enum ExecutionKind {
    LOCAL,
    REMOTE
}
