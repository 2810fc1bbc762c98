package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.model.ExecutionKind;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.model.PipelineStatus;
import com.deploypilot.engine.model.TriggerType;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of an execution run. The transcript is served separately
 * by GET /executions/{id}/logs.
 */
public record ExecutionResponse(
        UUID           id,
        UUID           pipelineId,
        int            pipelineVersion,
        ExecutionKind  kind,
        PipelineStatus status,
        TriggerType    triggerType,
        String         branch,
        Long           remoteBuildNumber,
        String         remoteRunUuid,
        String         remoteCommitHash,
        int            triggerAttempts,
        String         errorMessage,
        boolean        rolledBack,
        String         rollbackReason,
        UUID           previousExecutionId,
        Instant        startedAt,
        Instant        completedAt,
        Long           durationSeconds
) {
    public static ExecutionResponse from(ExecutionRun r) {
        return new ExecutionResponse(
                r.getId(),
                r.getPipelineId(),
                r.getPipelineVersion(),
                r.getKind(),
                r.getStatus(),
                r.getTriggerType(),
                r.getBranch(),
                r.getRemoteBuildNumber(),
                r.getRemoteRunUuid(),
                r.getRemoteCommitHash(),
                r.getTriggerAttempts(),
                r.getErrorMessage(),
                r.isRolledBack(),
                r.getRollbackReason(),
                r.getPreviousExecutionId(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getDurationSeconds()
        );
    }
}
