package com.deploypilot.engine.sandbox;

import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command with a wall-clock bound.
 *
 * Output goes to a temporary file rather than a pipe so a chatty process can
 * never block on a full pipe buffer while we wait for it.
 */
@Component
public class ProcessRunner {

    public CommandResult run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        File capture = Files.createTempFile("deploypilot-proc-", ".log").toFile();
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(capture);
            if (workingDir != null) {
                builder.directory(workingDir.toFile());
            }
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
                return CommandResult.timeout(read(capture));
            }
            return new CommandResult(process.exitValue(), read(capture), false);
        } finally {
            Files.deleteIfExists(capture.toPath());
        }
    }

    private static String read(File capture) throws IOException {
        return Files.readString(capture.toPath(), StandardCharsets.UTF_8);
    }
}
