package com.deploypilot.engine.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Temporary source tree shared by all steps of one sandbox run.
 *
 * Created from a local directory (copied), a clonable URL ({@code git clone})
 * or nothing at all (empty directory). Closing deletes the whole tree.
 */
public final class WorkingCopy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkingCopy.class);

    private final Path root;

    private WorkingCopy(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * @throws SandboxException with {@link SandboxFailure#CLONE_FAILED} if the
     *         source cannot be obtained; the temporary directory is removed first
     */
    public static WorkingCopy prepare(String sourceLocation, ProcessRunner processes, Duration cloneTimeout) {
        Path root;
        try {
            root = Files.createTempDirectory("deploypilot-ws-");
        } catch (IOException e) {
            throw new SandboxException(SandboxFailure.CLONE_FAILED,
                    "Could not create a temporary workspace: " + e.getMessage(), e);
        }
        WorkingCopy copy = new WorkingCopy(root);
        try {
            if (sourceLocation != null && !sourceLocation.isBlank()) {
                copy.populate(sourceLocation.strip(), processes, cloneTimeout);
            }
            return copy;
        } catch (RuntimeException e) {
            copy.close();
            throw e;
        }
    }

    private void populate(String source, ProcessRunner processes, Duration cloneTimeout) {
        Path local = asExistingDirectory(source);
        if (local != null) {
            try {
                FileSystemUtils.copyRecursively(local, root);
            } catch (IOException e) {
                throw new SandboxException(SandboxFailure.CLONE_FAILED,
                        "Failed to copy source tree " + source + ": " + e.getMessage(), e);
            }
            return;
        }

        CommandResult clone;
        try {
            clone = processes.run(List.of("git", "clone", "--quiet", source, root.toString()),
                    null, cloneTimeout);
        } catch (IOException e) {
            throw new SandboxException(SandboxFailure.CLONE_FAILED,
                    "Failed to clone repository: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException(SandboxFailure.TIMEOUT, "Interrupted while cloning " + source, e);
        }
        if (clone.timedOut()) {
            throw new SandboxException(SandboxFailure.CLONE_FAILED,
                    "Failed to clone repository: timed out after " + cloneTimeout.toSeconds() + "s");
        }
        if (!clone.success()) {
            throw new SandboxException(SandboxFailure.CLONE_FAILED,
                    "Failed to clone repository: " + clone.output().strip());
        }
    }

    private static Path asExistingDirectory(String source) {
        if (source.contains("://") || source.startsWith("git@")) return null;
        try {
            Path path = Path.of(source);
            return Files.isDirectory(path) ? path : null;
        } catch (RuntimeException e) {
            return null;
        }
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(root);
        } catch (IOException e) {
            log.warn("Could not delete working copy {}: {}", root, e.getMessage());
        }
    }
}
