package com.deploypilot.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    // ------------------------------------------------------------------
    // canTransition()
    // ------------------------------------------------------------------

    @Test
    void canTransition_intermediateStatesInAnyOrder() {
        assertThat(ExecutionStateMachine.canTransition(PipelineStatus.BUILDING, PipelineStatus.TESTING)).isTrue();
        assertThat(ExecutionStateMachine.canTransition(PipelineStatus.DEPLOYING, PipelineStatus.BUILDING)).isTrue();
        assertThat(ExecutionStateMachine.canTransition(PipelineStatus.TESTING, PipelineStatus.SUCCESS)).isTrue();
        assertThat(ExecutionStateMachine.canTransition(PipelineStatus.BUILDING, PipelineStatus.FAILED)).isTrue();
    }

    @Test
    void canTransition_neverBackToPlanned() {
        assertThat(ExecutionStateMachine.canTransition(PipelineStatus.BUILDING, PipelineStatus.PLANNED)).isFalse();
    }

    @Test
    void canTransition_nothingLeavesATerminalState() {
        for (PipelineStatus to : PipelineStatus.values()) {
            if (to != PipelineStatus.SUCCESS) {
                assertThat(ExecutionStateMachine.canTransition(PipelineStatus.SUCCESS, to)).isFalse();
            }
            if (to != PipelineStatus.FAILED) {
                assertThat(ExecutionStateMachine.canTransition(PipelineStatus.FAILED, to)).isFalse();
            }
        }
    }

    // ------------------------------------------------------------------
    // transition()
    // ------------------------------------------------------------------

    @Test
    void transition_sameState_isNoOp() {
        ExecutionRun run = newRun();

        assertThat(ExecutionStateMachine.transition(run, PipelineStatus.BUILDING, NOW)).isFalse();
        assertThat(run.getStatus()).isEqualTo(PipelineStatus.BUILDING);
        assertThat(run.getCompletedAt()).isNull();
    }

    @Test
    void transition_toTerminal_stampsCompletionAndDuration() {
        ExecutionRun run = newRun();

        assertThat(ExecutionStateMachine.transition(run, PipelineStatus.TESTING, NOW)).isTrue();
        assertThat(ExecutionStateMachine.transition(run, PipelineStatus.SUCCESS, NOW)).isTrue();

        assertThat(run.getStatus()).isEqualTo(PipelineStatus.SUCCESS);
        assertThat(run.getCompletedAt()).isEqualTo(NOW);
        assertThat(run.getDurationSeconds()).isGreaterThanOrEqualTo(59L);
    }

    @Test
    void transition_outOfTerminal_throws() {
        ExecutionRun run = newRun();
        ExecutionStateMachine.transition(run, PipelineStatus.FAILED, NOW);

        assertThatThrownBy(() -> ExecutionStateMachine.transition(run, PipelineStatus.BUILDING, NOW))
                .isInstanceOf(IllegalStateTransitionException.class)
                .satisfies(e -> {
                    IllegalStateTransitionException ex = (IllegalStateTransitionException) e;
                    assertThat(ex.from()).isEqualTo(PipelineStatus.FAILED);
                    assertThat(ex.to()).isEqualTo(PipelineStatus.BUILDING);
                });
    }

    // ------------------------------------------------------------------
    // complete()
    // ------------------------------------------------------------------

    @Test
    void complete_usesReportedCompletionAndDuration() {
        ExecutionRun run = newRun();
        Instant reported = NOW.minusSeconds(30);

        assertThat(ExecutionStateMachine.complete(run, PipelineStatus.SUCCESS, reported, 95L, NOW)).isTrue();

        assertThat(run.getCompletedAt()).isEqualTo(reported);
        assertThat(run.getDurationSeconds()).isEqualTo(95L);
    }

    @Test
    void complete_missingCompletionTime_fallsBackToNow() {
        ExecutionRun run = newRun();

        ExecutionStateMachine.complete(run, PipelineStatus.FAILED, null, null, NOW);

        assertThat(run.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void complete_repeatedWithSameStatus_changesNothing() {
        ExecutionRun run = newRun();
        ExecutionStateMachine.complete(run, PipelineStatus.SUCCESS, NOW, 10L, NOW);

        assertThat(ExecutionStateMachine.complete(run, PipelineStatus.SUCCESS, NOW.plusSeconds(60), 99L, NOW)).isFalse();
        assertThat(run.getCompletedAt()).isEqualTo(NOW);
        assertThat(run.getDurationSeconds()).isEqualTo(10L);
    }

    @Test
    void complete_conflictingTerminal_throws() {
        ExecutionRun run = newRun();
        ExecutionStateMachine.complete(run, PipelineStatus.SUCCESS, NOW, 10L, NOW);

        assertThatThrownBy(() -> ExecutionStateMachine.complete(run, PipelineStatus.FAILED, NOW, 10L, NOW))
                .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void complete_nonTerminalTarget_isRejected() {
        assertThatThrownBy(() -> ExecutionStateMachine.complete(newRun(), PipelineStatus.TESTING, NOW, null, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ExecutionRun newRun() {
        return new ExecutionRun(UUID.randomUUID(), 1, ExecutionKind.REMOTE, TriggerType.MANUAL, NOW.minusSeconds(90));
    }
}
