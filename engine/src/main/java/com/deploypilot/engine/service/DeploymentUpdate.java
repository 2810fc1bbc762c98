package com.deploypilot.engine.service;

/** Deployment parameters to change in place; null fields are left as they are. */
public record DeploymentUpdate(String deploymentServer, String defaultBranch, String sourceUrl) {}
