package com.deploypilot.engine.sandbox;

/**
 * Outcome of a sandbox run.
 *
 * @param success         true only if every step exited 0
 * @param combinedOutput  transcript of all executed steps, each under a {@code === name ===} header
 * @param failingStepName step that failed or timed out, null otherwise
 * @param error           human-readable failure description, null on success
 * @param failure         failure category, null on success
 * @param exitCode        exit code of the failing step, null unless {@code failure == STEP_FAILED}
 */
public record SandboxRunResult(
        boolean        success,
        String         combinedOutput,
        String         failingStepName,
        String         error,
        SandboxFailure failure,
        Integer        exitCode
) {
    public static SandboxRunResult passed(String combinedOutput) {
        return new SandboxRunResult(true, combinedOutput, null, null, null, null);
    }

    public static SandboxRunResult failed(String combinedOutput, String stepName,
                                          SandboxFailure failure, String error) {
        return new SandboxRunResult(false, combinedOutput, stepName, error, failure, null);
    }

    public static SandboxRunResult stepFailed(String combinedOutput, String stepName, int exitCode) {
        return new SandboxRunResult(false, combinedOutput, stepName,
                "Step \"%s\" failed with exit code %d".formatted(stepName, exitCode),
                SandboxFailure.STEP_FAILED, exitCode);
    }
}
