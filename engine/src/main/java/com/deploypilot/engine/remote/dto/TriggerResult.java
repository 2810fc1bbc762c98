package com.deploypilot.engine.remote.dto;

/** Identifiers of a freshly started remote run. */
public record TriggerResult(String runUuid, Long buildNumber, String state, String commitHash) {}
