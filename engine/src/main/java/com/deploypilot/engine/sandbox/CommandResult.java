package com.deploypilot.engine.sandbox;

/**
 * Exit status and captured output (stdout and stderr interleaved) of one
 * process. {@code exitCode} is -1 when the process was killed on timeout.
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    public static CommandResult timeout(String output) {
        return new CommandResult(-1, output, true);
    }
}
