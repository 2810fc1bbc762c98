package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.service.NewPipeline;

/**
 * Request body for POST /pipelines.
 *
 * Required: repositoryKey, remoteWorkspace, remoteRepoSlug, definitionYaml
 * Optional: sourceUrl (dry runs start from an empty working copy without it),
 *   defaultBranch (defaults to "main"), deploymentServer
 */
public record CreatePipelineRequest(String repositoryKey,
                                    String remoteWorkspace,
                                    String remoteRepoSlug,
                                    String sourceUrl,
                                    String defaultBranch,
                                    String deploymentServer,
                                    String definitionYaml) {

    public CreatePipelineRequest {
        if (defaultBranch == null || defaultBranch.isBlank()) defaultBranch = "main";
    }

    public NewPipeline toNewPipeline() {
        return new NewPipeline(repositoryKey, remoteWorkspace, remoteRepoSlug, sourceUrl,
                defaultBranch, deploymentServer, definitionYaml);
    }
}
