package com.deploypilot.engine.monitor;

import com.deploypilot.engine.event.*;
import com.deploypilot.engine.model.*;
import com.deploypilot.engine.remote.RemoteCiClient;
import com.deploypilot.engine.remote.TransientRemoteException;
import com.deploypilot.engine.remote.dto.RemoteRunRef;
import com.deploypilot.engine.remote.dto.RemoteRunStatus;
import com.deploypilot.engine.remote.dto.RemoteStepStatus;
import com.deploypilot.engine.service.ExecutionService;
import com.deploypilot.engine.service.PollTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StatusPoller.
 *
 * The remote backend is a Mockito mock returning a scripted sequence of
 * snapshots; events are collected from a real RunEventBus; the sleeper only
 * records the requested waits.
 */
@ExtendWith(MockitoExtension.class)
class StatusPollerTest {

    private static final UUID         RUN_ID      = UUID.randomUUID();
    private static final UUID         PIPELINE_ID = UUID.randomUUID();
    private static final RemoteRunRef REF         = new RemoteRunRef("acme", "shop", "{run-1}");
    private static final String       INSTANCE    = "instance-a";

    @Mock ExecutionService executionService;
    @Mock RemoteCiClient   client;

    RunEventBus         eventBus;
    List<RunEvent>      events = new ArrayList<>();
    List<Duration>      waits  = new ArrayList<>();
    SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        eventBus = new RunEventBus();
        eventBus.subscribe(PIPELINE_ID, events::add);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Test
    void poll_buildingBuildingCompleted_twoStatusChangesThreeFetchesOneCompletion() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(
                snapshot("IN_PROGRESS", step("Build", "IN_PROGRESS", null)),
                snapshot("IN_PROGRESS", step("Build", "IN_PROGRESS", null)),
                snapshot("COMPLETED",   step("Build", "COMPLETED", "compiled\n")));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.BUILDING)).thenReturn(PipelineStatus.BUILDING);
        when(executionService.completeRun(eq(RUN_ID), eq(PipelineStatus.SUCCESS), anyString(), any(), any()))
                .thenReturn(completedRun(PipelineStatus.SUCCESS, 42L));

        PollOutcome outcome = poller(settings(120, 1)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.COMPLETED);
        verify(client, times(3)).fetchStatus(REF);
        assertThat(types()).containsExactly(
                "status_changed", "log_update",                   // first fetch
                "status_changed", "log_update", "run_complete");  // third fetch; the second changed nothing

        List<StatusChanged> changes = ofType(StatusChanged.class);
        assertThat(changes).extracting(StatusChanged::status)
                .containsExactly(PipelineStatus.BUILDING, PipelineStatus.SUCCESS);
        assertThat(changes.get(1).previousStatus()).isEqualTo(PipelineStatus.BUILDING);
        assertThat(ofType(RunComplete.class).get(0).durationSeconds()).isEqualTo(42L);
        assertThat(waits).hasSize(2);
        verify(executionService).completeRun(RUN_ID, PipelineStatus.SUCCESS, "=== Build ===\ncompiled\n", null, null);
        verify(executionService).releasePollLease(RUN_ID, INSTANCE);
    }

    @Test
    void poll_buildTestDeploySucceed_statusFollowsEveryStage() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(
                snapshot("BUILDING"),
                snapshot("TESTING"),
                snapshot("DEPLOYING"),
                snapshot("COMPLETED"));
        when(executionService.recordStatus(eq(RUN_ID), any())).thenReturn(
                PipelineStatus.BUILDING, PipelineStatus.BUILDING, PipelineStatus.TESTING);
        when(executionService.completeRun(eq(RUN_ID), eq(PipelineStatus.SUCCESS), anyString(), any(), any()))
                .thenReturn(completedRun(PipelineStatus.SUCCESS, 10L));

        poller(settings(120, 1)).poll(RUN_ID);

        assertThat(ofType(StatusChanged.class)).extracting(StatusChanged::status).containsExactly(
                PipelineStatus.BUILDING, PipelineStatus.TESTING, PipelineStatus.DEPLOYING, PipelineStatus.SUCCESS);
        assertThat(ofType(RunComplete.class)).hasSize(1);
    }

    @Test
    void poll_remoteFailure_completesAsFailed() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(snapshot("STOPPED", step("Build", "STOPPED", "killed")));
        when(executionService.completeRun(eq(RUN_ID), eq(PipelineStatus.FAILED), anyString(), any(), any()))
                .thenReturn(completedRun(PipelineStatus.FAILED, 3L));

        PollOutcome outcome = poller(settings(120, 1)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.COMPLETED);
        assertThat(types()).containsExactly("status_changed", "log_update", "run_complete");
        assertThat(ofType(RunComplete.class).get(0).status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(waits).isEmpty();                      // no fetch after a terminal state
        verify(executionService, never()).recordStatus(any(), any());
    }

    @Test
    void poll_logUpdate_carriesOnlyChangedStepsWithTruncatedPreview() {
        livePollTarget();
        String longLog = "x".repeat(800);
        when(client.fetchStatus(REF)).thenReturn(
                snapshot("IN_PROGRESS", step("Build", "IN_PROGRESS", null), step("Deploy", "PENDING", null)),
                snapshot("IN_PROGRESS", step("Build", "COMPLETED", longLog), step("Deploy", "PENDING", null)),
                snapshot("COMPLETED",   step("Build", "COMPLETED", longLog), step("Deploy", "COMPLETED", "ok")));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.BUILDING)).thenReturn(PipelineStatus.BUILDING);
        when(executionService.completeRun(eq(RUN_ID), eq(PipelineStatus.SUCCESS), anyString(), any(), any()))
                .thenReturn(completedRun(PipelineStatus.SUCCESS, 5L));

        poller(settings(120, 1)).poll(RUN_ID);

        List<LogUpdate> updates = ofType(LogUpdate.class);
        assertThat(updates).hasSize(3);
        assertThat(updates.get(0).steps()).extracting(StepSnapshot::name).containsExactly("Build", "Deploy");
        assertThat(updates.get(1).steps()).extracting(StepSnapshot::name).containsExactly("Build");
        assertThat(updates.get(1).steps().get(0).logPreview()).hasSize(500);
        assertThat(updates.get(2).steps()).extracting(StepSnapshot::name).containsExactly("Deploy");
    }

    // ------------------------------------------------------------------
    // Timeout / errors / cancellation
    // ------------------------------------------------------------------

    @Test
    void poll_iterationCapReached_emitsOneTimeoutAndLeavesStatusAlone() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(snapshot("IN_PROGRESS", step("Build", "IN_PROGRESS", null)));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.BUILDING)).thenReturn(PipelineStatus.BUILDING);

        PollOutcome outcome = poller(settings(3, 1)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.TIMED_OUT);
        verify(client, times(3)).fetchStatus(REF);
        assertThat(ofType(PollTimeout.class)).hasSize(1);
        assertThat(types()).last().isEqualTo("poll_timeout");
        assertThat(waits).hasSize(2);                     // no wait after the last fetch
        verify(executionService, never()).completeRun(any(), any(), any(), any(), any());
        verify(executionService, never()).recordPollError(any(), any());
    }

    @Test
    void poll_fetchFails_emitsPollErrorAndStops() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenThrow(new TransientRemoteException("HTTP 503", 503));

        PollOutcome outcome = poller(settings(120, 1)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.FETCH_FAILED);
        verify(client, times(1)).fetchStatus(REF);
        assertThat(types()).containsExactly("poll_error");
        assertThat(ofType(PollError.class).get(0).error()).contains("HTTP 503");
        verify(executionService).recordPollError(eq(RUN_ID), contains("HTTP 503"));
        verify(executionService, never()).recordStatus(any(), any());
        verify(executionService).releasePollLease(RUN_ID, INSTANCE);
    }

    @Test
    void poll_toleratesFetchErrorsBelowTheLimit() {
        livePollTarget();
        when(client.fetchStatus(REF))
                .thenThrow(new TransientRemoteException("HTTP 502", 502))
                .thenReturn(snapshot("COMPLETED"));
        when(executionService.completeRun(eq(RUN_ID), eq(PipelineStatus.SUCCESS), anyString(), any(), any()))
                .thenReturn(completedRun(PipelineStatus.SUCCESS, 1L));

        PollOutcome outcome = poller(settings(120, 2)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.COMPLETED);
        assertThat(ofType(PollError.class)).isEmpty();
    }

    @Test
    void poll_unknownRemoteState_noStatusChange() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(snapshot("PAUSED", step("Build", "PAUSED", null)));

        poller(settings(1, 1)).poll(RUN_ID);

        assertThat(types()).containsExactly("log_update", "poll_timeout");
        assertThat(ofType(LogUpdate.class).get(0).overallStatus()).isEqualTo(PipelineStatus.BUILDING);
        verify(executionService, never()).recordStatus(any(), any());
    }

    @Test
    void poll_interruptedWhileWaiting_stopsWithoutFurtherEvents() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(snapshot("IN_PROGRESS"));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.BUILDING)).thenReturn(PipelineStatus.BUILDING);
        StatusPoller poller = new StatusPoller(executionService, client, eventBus,
                d -> { throw new InterruptedException(); }, settings(120, 1), meterRegistry, INSTANCE);

        PollOutcome outcome = poller.poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.CANCELLED);
        verify(client, times(1)).fetchStatus(REF);
        assertThat(types()).doesNotContain("poll_timeout", "poll_error", "run_complete");
        verify(executionService).releasePollLease(RUN_ID, INSTANCE);
    }

    @Test
    void poll_persistenceFails_reportsPollError() {
        livePollTarget();
        when(client.fetchStatus(REF)).thenReturn(snapshot("TESTING"));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.TESTING))
                .thenThrow(new IllegalStateException("database unavailable"));

        PollOutcome outcome = poller(settings(120, 1)).poll(RUN_ID);

        assertThat(outcome).isEqualTo(PollOutcome.ERROR);
        assertThat(types()).containsExactly("poll_error");
        verify(executionService).releasePollLease(RUN_ID, INSTANCE);
    }

    // ------------------------------------------------------------------
    // Preconditions
    // ------------------------------------------------------------------

    @Test
    void poll_terminalRun_isNotPolled() {
        when(executionService.pollTarget(RUN_ID)).thenReturn(
                new PollTarget(RUN_ID, PIPELINE_ID, ExecutionKind.REMOTE, PipelineStatus.SUCCESS, REF));

        assertThat(poller(settings(120, 1)).poll(RUN_ID)).isEqualTo(PollOutcome.NOT_POLLABLE);
        verifyNoInteractions(client);
        verify(executionService, never()).claimPollLease(any(), any(), any());
    }

    @Test
    void poll_leaseHeldElsewhere_isNotPolled() {
        when(executionService.pollTarget(RUN_ID)).thenReturn(
                new PollTarget(RUN_ID, PIPELINE_ID, ExecutionKind.REMOTE, PipelineStatus.BUILDING, REF));
        when(executionService.claimPollLease(eq(RUN_ID), eq(INSTANCE), any())).thenReturn(false);

        assertThat(poller(settings(120, 1)).poll(RUN_ID)).isEqualTo(PollOutcome.LEASE_UNAVAILABLE);
        verifyNoInteractions(client);
        verify(executionService, never()).releasePollLease(any(), any());
    }

    @Test
    void poll_leaseLostMidway_stops() {
        when(executionService.pollTarget(RUN_ID)).thenReturn(
                new PollTarget(RUN_ID, PIPELINE_ID, ExecutionKind.REMOTE, PipelineStatus.BUILDING, REF));
        when(executionService.claimPollLease(eq(RUN_ID), eq(INSTANCE), any())).thenReturn(true, false);
        when(client.fetchStatus(REF)).thenReturn(snapshot("IN_PROGRESS"));
        when(executionService.recordStatus(RUN_ID, PipelineStatus.BUILDING)).thenReturn(PipelineStatus.BUILDING);

        assertThat(poller(settings(120, 1)).poll(RUN_ID)).isEqualTo(PollOutcome.LEASE_UNAVAILABLE);
        verify(client, times(1)).fetchStatus(REF);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StatusPoller poller(MonitorSettings settings) {
        return new StatusPoller(executionService, client, eventBus, waits::add, settings, meterRegistry, INSTANCE);
    }

    private static MonitorSettings settings(int maxIterations, int maxFetchErrors) {
        return new MonitorSettings(Duration.ofSeconds(5), maxIterations, maxFetchErrors,
                Duration.ofMinutes(2), 500, 4);
    }

    private void livePollTarget() {
        when(executionService.pollTarget(RUN_ID)).thenReturn(
                new PollTarget(RUN_ID, PIPELINE_ID, ExecutionKind.REMOTE, PipelineStatus.BUILDING, REF));
        when(executionService.claimPollLease(eq(RUN_ID), eq(INSTANCE), any())).thenReturn(true);
    }

    private static RemoteRunStatus snapshot(String state, RemoteStepStatus... steps) {
        return new RemoteRunStatus(state, List.of(steps), null, null);
    }

    private static RemoteStepStatus step(String name, String state, String log) {
        return new RemoteStepStatus("{" + name + "}", name, state, null, log);
    }

    private static ExecutionRun completedRun(PipelineStatus status, long durationSeconds) {
        Instant started = Instant.parse("2026-03-01T10:00:00Z");
        ExecutionRun run = new ExecutionRun(PIPELINE_ID, 1, ExecutionKind.REMOTE, TriggerType.MANUAL, started);
        ExecutionStateMachine.complete(run, status, null, durationSeconds, started.plusSeconds(durationSeconds));
        return run;
    }

    private List<String> types() {
        return events.stream().map(RunEvent::type).toList();
    }

    private <T extends RunEvent> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
