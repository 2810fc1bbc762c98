package com.deploypilot.engine.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Docker-backed sandboxes, driven through the {@code docker} CLI.
 *
 * Each sandbox is one container started from the step image with the
 * working copy bind-mounted at /workspace. The container idles on an open
 * stdin; step scripts run through {@code docker exec}, and close() removes
 * the container with {@code docker rm -f}, which also kills anything still
 * running inside it.
 */
@Component
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String MOUNT_POINT = "/workspace";

    private static final Duration INSPECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REMOVE_TIMEOUT  = Duration.ofSeconds(60);

    private final ProcessRunner processes;
    private final String        docker;
    private final Duration      pullTimeout;

    public DockerSandboxProvider(
            ProcessRunner processes,
            @Value("${deploypilot.sandbox.docker-binary:docker}") String docker,
            @Value("${deploypilot.sandbox.pull-timeout:PT10M}") Duration pullTimeout) {
        this.processes   = processes;
        this.docker      = docker;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public Sandbox provision(String image, Path workingCopy, Duration timeout) {
        Duration limit = timeout.compareTo(pullTimeout) < 0 ? timeout : pullTimeout;
        boolean runBound = limit.equals(timeout);
        ensureImage(image, limit, runBound);

        String name = "deploypilot-" + UUID.randomUUID().toString().substring(0, 12);
        CommandResult started = docker(List.of(docker, "run", "-d", "-i",
                "--name", name,
                "--label", "deploypilot.sandbox=true",
                "-v", workingCopy.toAbsolutePath() + ":" + MOUNT_POINT + ":rw",
                "-w", MOUNT_POINT,
                "--entrypoint", "/bin/sh",
                image), limit, "start container from " + image);
        if (!started.success()) {
            // The name may already be taken by a half-created container.
            remove(name);
            throw new SandboxException(failureKind(started, runBound),
                    "Could not start container from image " + image + ": " + started.output().strip());
        }
        log.debug("Provisioned sandbox {} from {}", name, image);
        return new DockerSandbox(name);
    }

    private void ensureImage(String image, Duration limit, boolean runBound) {
        CommandResult inspect = docker(List.of(docker, "image", "inspect", image),
                INSPECT_TIMEOUT, "inspect image " + image);
        if (inspect.success()) return;

        log.info("Pulling image {}", image);
        CommandResult pull = docker(List.of(docker, "pull", image), limit, "pull image " + image);
        if (!pull.success()) {
            throw new SandboxException(failureKind(pull, runBound),
                    "Docker image not available: " + image
                    + (pull.timedOut() ? " (pull timed out)" : ": " + pull.output().strip()));
        }
    }

    /** A docker call cut short by the caller's run deadline is a timeout, anything else a missing environment. */
    private static SandboxFailure failureKind(CommandResult result, boolean runBound) {
        return result.timedOut() && runBound ? SandboxFailure.TIMEOUT : SandboxFailure.ENVIRONMENT_UNAVAILABLE;
    }

    private void remove(String name) {
        try {
            CommandResult rm = processes.run(List.of(docker, "rm", "-f", name), null, REMOVE_TIMEOUT);
            if (!rm.success()) {
                log.warn("Could not remove sandbox container {}, manual cleanup may be needed: {}",
                        name, rm.output().strip());
            }
        } catch (IOException e) {
            log.warn("Could not remove sandbox container {}: {}", name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while removing sandbox container {}", name);
        }
    }

    /** Runs a docker command; a missing or broken docker binary means no environment. */
    private CommandResult docker(List<String> command, Duration timeout, String opName) {
        try {
            return processes.run(command, null, timeout);
        } catch (IOException e) {
            throw new SandboxException(SandboxFailure.ENVIRONMENT_UNAVAILABLE,
                    "Container runtime unavailable (" + opName + "): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException(SandboxFailure.TIMEOUT, "Interrupted during " + opName, e);
        }
    }

    // ------------------------------------------------------------------
    // Sandbox handle
    // ------------------------------------------------------------------

    private final class DockerSandbox implements Sandbox {

        private final String container;
        private boolean closed;

        private DockerSandbox(String container) {
            this.container = container;
        }

        @Override
        public CommandResult execute(String scriptPath, Duration timeout) {
            String script = MOUNT_POINT + "/" + scriptPath;
            // Prefer bash (scripts use bash semantics), fall back to sh on minimal images.
            return docker(List.of(docker, "exec", container, "/bin/sh", "-c",
                    "if command -v bash >/dev/null 2>&1; then exec bash \"$0\"; else exec sh \"$0\"; fi",
                    script), timeout, "exec in " + container);
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            remove(container);
            log.debug("Destroyed sandbox {}", container);
        }
    }
}
