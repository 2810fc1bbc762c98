package com.deploypilot.engine.remote.dto;

/**
 * What to start on the remote backend. {@code commitHash} pins the run to
 * a specific commit on {@code branch} (used by rollbacks); null means head.
 */
public record TriggerRequest(String workspace, String repoSlug, String branch, String commitHash) {

    public TriggerRequest(String workspace, String repoSlug, String branch) {
        this(workspace, repoSlug, branch, null);
    }
}
