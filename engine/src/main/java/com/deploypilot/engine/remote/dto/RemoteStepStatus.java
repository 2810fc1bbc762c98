package com.deploypilot.engine.remote.dto;

/**
 * State of one remote step at fetch time.
 *
 * @param uuid remote step id, null when the remote did not report one
 * @param log  full step log so far, may be null while the step is pending
 */
public record RemoteStepStatus(String uuid, String name, String state, Long durationSeconds, String log) {}
