package com.deploypilot.engine.service;

import com.deploypilot.engine.model.*;
import com.deploypilot.engine.remote.RemoteCiClient;
import com.deploypilot.engine.remote.TransientRemoteException;
import com.deploypilot.engine.remote.dto.TriggerResult;
import com.deploypilot.engine.repository.ExecutionRunRepository;
import com.deploypilot.engine.repository.PipelineRepository;
import com.deploypilot.engine.retry.RetryOptions;
import com.deploypilot.engine.retry.Sleeper;
import com.deploypilot.engine.retry.TriggerExhaustedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs against a real PostgreSQL: Flyway applies V1, Hibernate validates the
 * entities against it, and the hand-written lease and orphan queries run as
 * written.
 *
 * The remote backend and the backoff sleeper are mocked.
 */
@SpringBootTest(properties = "deploypilot.monitor.recovery-interval=PT1H")
@Testcontainers(disabledWithoutDocker = true)
class ExecutionPersistenceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("deploypilot")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @MockitoBean RemoteCiClient remote;
    @MockitoBean Sleeper        sleeper;

    @Autowired ExecutionService       executionService;
    @Autowired ExecutionAuditWriter   auditWriter;
    @Autowired TriggerRecorder        triggerRecorder;
    @Autowired PipelineRepository     pipelineRepo;
    @Autowired ExecutionRunRepository runRepo;
    @Autowired TransactionTemplate    transactions;

    // ------------------------------------------------------------------
    // Failed trigger record
    // ------------------------------------------------------------------

    @Test
    void trigger_allAttemptsFail_failedRunIsCommitted() {
        Pipeline pipeline = newPipeline();
        when(remote.trigger(any())).thenThrow(new TransientRemoteException("HTTP 503", 503));

        Throwable thrown = catchThrowable(() -> executionService.trigger(pipeline.getId(),
                new TriggerCommand(null, TriggerType.MANUAL, new RetryOptions(true, 2), true)));

        assertThat(thrown).isInstanceOf(TriggerExhaustedException.class);
        TriggerExhaustedException e = (TriggerExhaustedException) thrown;
        assertThat(e.attempts()).isEqualTo(3);
        ExecutionRun failed = runRepo.findById(e.executionId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.getTriggerAttempts()).isEqualTo(3);
        assertThat(failed.getErrorMessage()).isEqualTo("HTTP 503");
        assertThat(failed.getCompletedAt()).isNotNull();
        assertThat(pipelineRepo.findById(pipeline.getId()).orElseThrow().getStatus())
                .isEqualTo(PipelineStatus.FAILED);
    }

    @Test
    void recordFailedTrigger_survivesRollbackOfEnclosingTransaction() {
        Pipeline pipeline = newPipeline();
        UUID[] failedRunId = new UUID[1];

        transactions.executeWithoutResult(status -> {
            failedRunId[0] = auditWriter.recordFailedTrigger(new FailedTrigger(pipeline.getId(), 1,
                    TriggerType.MANUAL, "main", 4, "HTTP 502", null, null));
            status.setRollbackOnly();
        });

        assertThat(runRepo.findById(failedRunId[0]))
                .hasValueSatisfying(run -> assertThat(run.getStatus()).isEqualTo(PipelineStatus.FAILED));
    }

    // ------------------------------------------------------------------
    // Poll lease
    // ------------------------------------------------------------------

    @Test
    void pollLease_heldByOneOwnerUntilReleased() {
        UUID runId = liveRun().getId();
        Duration ttl = Duration.ofMinutes(2);

        assertThat(executionService.claimPollLease(runId, "instance-a", ttl)).isTrue();
        assertThat(executionService.claimPollLease(runId, "instance-b", ttl)).isFalse();
        assertThat(executionService.claimPollLease(runId, "instance-a", ttl)).isTrue();    // renewal

        executionService.releasePollLease(runId, "instance-b");                        // not the owner
        assertThat(executionService.claimPollLease(runId, "instance-b", ttl)).isFalse();

        executionService.releasePollLease(runId, "instance-a");
        assertThat(executionService.claimPollLease(runId, "instance-b", ttl)).isTrue();
    }

    @Test
    void pollLease_expiredLeaseCanBeTakenOver() {
        UUID runId = liveRun().getId();

        assertThat(executionService.claimPollLease(runId, "instance-a", Duration.ofSeconds(-1))).isTrue();

        assertThat(executionService.claimPollLease(runId, "instance-b", Duration.ofMinutes(2))).isTrue();
        assertThat(runRepo.findById(runId).orElseThrow().getPollLeaseOwner()).isEqualTo("instance-b");
    }

    @Test
    void orphanedRuns_onlyExpiredUnreleasedLeases() {
        UUID orphan   = liveRun().getId();
        UUID released = liveRun().getId();
        UUID held     = liveRun().getId();
        UUID never    = liveRun().getId();

        executionService.claimPollLease(orphan, "gone", Duration.ofSeconds(-1));
        executionService.claimPollLease(released, "instance-a", Duration.ofSeconds(-1));
        executionService.releasePollLease(released, "instance-a");
        executionService.claimPollLease(held, "instance-a", Duration.ofMinutes(2));

        assertThat(executionService.orphanedRuns())
                .contains(orphan)
                .doesNotContain(released, held, never);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Pipeline newPipeline() {
        return pipelineRepo.save(new Pipeline("acme/" + UUID.randomUUID(), "acme", "shop",
                "pipelines:\n  default:\n    - step:\n        script: [make]\n"));
    }

    private ExecutionRun liveRun() {
        Pipeline pipeline = newPipeline();
        return triggerRecorder.recordStarted(new StartedTrigger(pipeline.getId(), 1, TriggerType.MANUAL, "main",
                null, new TriggerResult("{" + UUID.randomUUID() + "}", 1L, "PENDING", null), 1, false, null, null));
    }
}
