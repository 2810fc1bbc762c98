package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.sandbox.SandboxFailure;
import com.deploypilot.engine.sandbox.SandboxRunResult;
import com.deploypilot.engine.service.DryRun;

/** Response body for POST /pipelines/{id}/test. */
public record DryRunResponse(
        ExecutionResponse execution,
        boolean           success,
        String            failingStep,
        SandboxFailure    failure,
        Integer           exitCode,
        String            error,
        String            output
) {
    public static DryRunResponse from(DryRun dryRun) {
        SandboxRunResult result = dryRun.result();
        return new DryRunResponse(
                ExecutionResponse.from(dryRun.run()),
                result.success(),
                result.failingStepName(),
                result.failure(),
                result.exitCode(),
                result.error(),
                result.combinedOutput()
        );
    }
}
