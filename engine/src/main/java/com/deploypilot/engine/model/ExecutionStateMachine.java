package com.deploypilot.engine.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Transition rules for {@link ExecutionRun#getStatus()}.
 *
 * <pre>
 *   BUILDING ⇄ TESTING ⇄ DEPLOYING      (intermediate states, any order)
 *        \        |        /
 *         SUCCESS | FAILED              (terminal, reachable from any of the above)
 * </pre>
 *
 * Runs never go back to PLANNED, and nothing leaves a terminal state: a
 * re-run is a new ExecutionRun. Setting the current status again is a no-op,
 * which makes replayed poll results harmless.
 */
public final class ExecutionStateMachine {

    private ExecutionStateMachine() {}

    public static boolean canTransition(PipelineStatus from, PipelineStatus to) {
        if (from == to) return true;
        if (from.isTerminal()) return false;
        return to != PipelineStatus.PLANNED;
    }

    /**
     * Move a run to {@code to}.
     *
     * @return true if the status changed, false for a same-state no-op
     * @throws IllegalStateTransitionException if the transition is not allowed
     */
    public static boolean transition(ExecutionRun run, PipelineStatus to, Instant now) {
        PipelineStatus from = run.getStatus();
        if (!canTransition(from, to)) {
            throw new IllegalStateTransitionException(run.getId(), from, to);
        }
        if (from == to) return false;

        run.setStatus(to);
        if (to.isTerminal()) {
            run.setCompletedAt(now);
            if (run.getDurationSeconds() == null) {
                run.setDurationSeconds(Duration.between(run.getStartedAt(), now).toSeconds());
            }
        }
        return true;
    }

    /**
     * Terminal transition with the completion data reported by the remote
     * backend. A null {@code completedAt} falls back to {@code now}.
     */
    public static boolean complete(ExecutionRun run, PipelineStatus terminal,
                                   Instant completedAt, Long durationSeconds, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        if (run.getStatus().isTerminal()) {
            if (run.getStatus() == terminal) return false;
            throw new IllegalStateTransitionException(run.getId(), run.getStatus(), terminal);
        }
        if (durationSeconds != null) {
            run.setDurationSeconds(durationSeconds);
        }
        return transition(run, terminal, completedAt != null ? completedAt : now);
    }
}
