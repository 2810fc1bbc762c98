package com.deploypilot.engine.service;

import com.deploypilot.engine.model.*;
import com.deploypilot.engine.repository.ExecutionRunRepository;
import com.deploypilot.engine.repository.PipelineRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExecutionAuditWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock ExecutionRunRepository runRepo;
    @Mock PipelineRepository     pipelineRepo;

    @Test
    void recordFailedTrigger_storesTerminalFailedRunAndFailsPipeline() {
        Pipeline pipeline = new Pipeline("acme/shop", "acme", "shop", "pipelines: {}");
        UUID pipelineId = UUID.randomUUID();
        UUID supersededId = UUID.randomUUID();
        when(runRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(pipelineRepo.findById(pipelineId)).thenReturn(Optional.of(pipeline));

        ExecutionAuditWriter writer = new ExecutionAuditWriter(runRepo, pipelineRepo, Clock.fixed(NOW, ZoneOffset.UTC));
        writer.recordFailedTrigger(new FailedTrigger(pipelineId, 3, TriggerType.MANUAL, "main",
                4, "HTTP 503", supersededId, "bad release"));

        ArgumentCaptor<ExecutionRun> saved = ArgumentCaptor.forClass(ExecutionRun.class);
        verify(runRepo).save(saved.capture());
        ExecutionRun run = saved.getValue();
        assertThat(run.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(run.getKind()).isEqualTo(ExecutionKind.REMOTE);
        assertThat(run.getPipelineVersion()).isEqualTo(3);
        assertThat(run.getTriggerAttempts()).isEqualTo(4);
        assertThat(run.getErrorMessage()).isEqualTo("HTTP 503");
        assertThat(run.getRemoteRunUuid()).isNull();
        assertThat(run.getStartedAt()).isEqualTo(NOW);
        assertThat(run.getCompletedAt()).isEqualTo(NOW);
        assertThat(run.getDurationSeconds()).isZero();
        assertThat(run.getPreviousExecutionId()).isEqualTo(supersededId);

        assertThat(pipeline.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(pipeline.getLastExecutionAt()).isEqualTo(NOW);
    }
}
