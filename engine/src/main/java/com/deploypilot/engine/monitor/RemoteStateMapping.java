package com.deploypilot.engine.monitor;

import com.deploypilot.engine.model.PipelineStatus;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translation of remote run states into {@link PipelineStatus}.
 *
 * States missing from the table map to nothing: the poller leaves the run
 * status alone until it sees a state it knows.
 */
public final class RemoteStateMapping {

    private static final Map<String, PipelineStatus> TABLE = Map.ofEntries(
            Map.entry("PENDING",     PipelineStatus.BUILDING),
            Map.entry("IN_PROGRESS", PipelineStatus.BUILDING),
            Map.entry("RUNNING",     PipelineStatus.BUILDING),
            Map.entry("BUILDING",    PipelineStatus.BUILDING),
            Map.entry("TESTING",     PipelineStatus.TESTING),
            Map.entry("DEPLOYING",   PipelineStatus.DEPLOYING),
            Map.entry("COMPLETED",   PipelineStatus.SUCCESS),
            Map.entry("FAILED",      PipelineStatus.FAILED),
            Map.entry("STOPPED",     PipelineStatus.FAILED),
            Map.entry("ERROR",       PipelineStatus.FAILED)
    );

    // Remote states after which the run never changes again.
    private static final Set<String> TERMINAL = Set.of("COMPLETED", "FAILED", "STOPPED", "ERROR");

    private RemoteStateMapping() {}

    public static Optional<PipelineStatus> toInternal(String remoteState) {
        if (remoteState == null) return Optional.empty();
        return Optional.ofNullable(TABLE.get(normalize(remoteState)));
    }

    public static boolean isTerminal(String remoteState) {
        return remoteState != null && TERMINAL.contains(normalize(remoteState));
    }

    private static String normalize(String remoteState) {
        return remoteState.trim().toUpperCase(Locale.ROOT);
    }
}
