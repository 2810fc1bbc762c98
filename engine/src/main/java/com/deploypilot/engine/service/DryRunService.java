package com.deploypilot.engine.service;

import com.deploypilot.engine.definition.PipelineDefinition;
import com.deploypilot.engine.model.Pipeline;
import com.deploypilot.engine.sandbox.SandboxRunResult;
import com.deploypilot.engine.sandbox.SandboxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs a pipeline's current definition in local sandboxes and records the
 * result as a LOCAL execution run.
 *
 * Not @Transactional: a sandbox run can take up to the run
 * timeout, and no DB connection is held while it executes. Opening and
 * completing the run are separate short transactions.
 */
@Service
public class DryRunService {

    private static final Logger log = LoggerFactory.getLogger(DryRunService.class);

    private final PipelineService  pipelineService;
    private final ExecutionService executionService;
    private final SandboxRunner    sandboxRunner;

    public DryRunService(PipelineService pipelineService,
                         ExecutionService executionService,
                         SandboxRunner sandboxRunner) {
        this.pipelineService  = pipelineService;
        this.executionService = executionService;
        this.sandboxRunner    = sandboxRunner;
    }

    /**
     * @throws InvalidDefinitionException when the stored definition does not validate; no run is created
     */
    public DryRun test(UUID pipelineId) {
        Pipeline pipeline = pipelineService.get(pipelineId);
        PipelineDefinition definition = pipelineService.definitionOf(pipeline);

        LocalRun local = executionService.openLocalRun(pipelineId);
        MDC.put("pipelineId", pipelineId.toString());
        MDC.put("runId",      local.runId().toString());
        try {
            log.info("Dry run of pipeline {} v{} started ({} step(s))",
                    pipelineId, local.pipelineVersion(), definition.steps().size());
            SandboxRunResult result = sandboxRunner.run(definition, local.sourceUrl());
            if (result.success()) {
                log.info("Dry run of pipeline {} passed", pipelineId);
            } else {
                log.warn("Dry run of pipeline {} failed at step {}: {}",
                        pipelineId, result.failingStepName(), result.error());
            }
            return new DryRun(executionService.completeLocalRun(local.runId(), result), result);
        } finally {
            MDC.remove("runId");
            MDC.remove("pipelineId");
        }
    }
}
