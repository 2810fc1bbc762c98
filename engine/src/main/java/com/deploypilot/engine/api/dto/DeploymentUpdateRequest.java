package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.service.DeploymentUpdate;

/** Request body for PATCH /pipelines/{id}/deployment. Null fields are left unchanged. */
public record DeploymentUpdateRequest(String deploymentServer, String defaultBranch, String sourceUrl) {

    public DeploymentUpdate toUpdate() {
        return new DeploymentUpdate(deploymentServer, defaultBranch, sourceUrl);
    }
}
