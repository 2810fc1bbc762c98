package com.deploypilot.engine.service;

/**
 * Input for creating the active pipeline of a repository.
 * {@code definitionYaml} is the generated pipeline document.
 */
public record NewPipeline(
        String repositoryKey,
        String remoteWorkspace,
        String remoteRepoSlug,
        String sourceUrl,
        String defaultBranch,
        String deploymentServer,
        String definitionYaml
) {}
