package com.deploypilot.engine.remote.dto;

/** Address of one remote run. */
public record RemoteRunRef(String workspace, String repoSlug, String runUuid) {}
