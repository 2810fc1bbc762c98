package com.deploypilot.engine.monitor;

/** Why a poll loop ended. */
public enum PollOutcome {
    /** Remote run reached a terminal state and the result was persisted. */
    COMPLETED,
    /** Iteration cap reached; run status left untouched. */
    TIMED_OUT,
    /** Remote status could not be fetched. */
    FETCH_FAILED,
    /** Persisting a poll result failed. */
    ERROR,
    /** Interrupted by cancellation or shutdown. */
    CANCELLED,
    /** Run is terminal, local, or has no remote id. */
    NOT_POLLABLE,
    /** Another instance holds the run's poll lease. */
    LEASE_UNAVAILABLE
}
