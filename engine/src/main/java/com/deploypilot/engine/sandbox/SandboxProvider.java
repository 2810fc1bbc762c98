package com.deploypilot.engine.sandbox;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Provisions fresh sandboxes. The working copy is shared by every sandbox of
 * a run; nothing else carries over from one step to the next.
 */
public interface SandboxProvider {

    /**
     * @param timeout upper bound for pulling the image and starting the sandbox
     * @throws SandboxException with {@link SandboxFailure#ENVIRONMENT_UNAVAILABLE}
     *         if the image or the runtime cannot be provided, or
     *         {@link SandboxFailure#TIMEOUT} if {@code timeout} ran out first
     */
    Sandbox provision(String image, Path workingCopy, Duration timeout);
}
