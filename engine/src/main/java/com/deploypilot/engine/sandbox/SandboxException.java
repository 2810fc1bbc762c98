package com.deploypilot.engine.sandbox;

/**
 * Raised inside the sandbox layer and converted into a
 * {@link SandboxRunResult} by {@link SandboxRunner}; it never leaves the runner.
 */
public class SandboxException extends RuntimeException {

    private final SandboxFailure kind;

    public SandboxException(SandboxFailure kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxException(SandboxFailure kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SandboxFailure getKind() { return kind; }
}
