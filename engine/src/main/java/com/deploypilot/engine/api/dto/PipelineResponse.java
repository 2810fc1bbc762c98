package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.model.Pipeline;
import com.deploypilot.engine.model.PipelineStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the /pipelines endpoints. The status mirrors the
 * pipeline's latest execution run.
 */
public record PipelineResponse(
        UUID           id,
        String         repositoryKey,
        String         remoteWorkspace,
        String         remoteRepoSlug,
        String         sourceUrl,
        String         defaultBranch,
        String         deploymentServer,
        int            version,
        boolean        active,
        PipelineStatus status,
        String         definitionYaml,
        String         testOutput,
        String         errorMessage,
        Instant        lastExecutionAt,
        Instant        createdAt,
        Instant        updatedAt
) {
    public static PipelineResponse from(Pipeline p) {
        return new PipelineResponse(
                p.getId(),
                p.getRepositoryKey(),
                p.getRemoteWorkspace(),
                p.getRemoteRepoSlug(),
                p.getSourceUrl(),
                p.getDefaultBranch(),
                p.getDeploymentServer(),
                p.getVersion(),
                p.isActive(),
                p.getStatus(),
                p.getDefinitionYaml(),
                p.getTestOutput(),
                p.getErrorMessage(),
                p.getLastExecutionAt(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
