package com.deploypilot.engine.api;

import com.deploypilot.engine.api.dto.*;
import com.deploypilot.engine.model.Pipeline;
import com.deploypilot.engine.service.DryRunService;
import com.deploypilot.engine.service.ExecutionService;
import com.deploypilot.engine.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for pipelines.
 *
 * POST  /pipelines                   create the repository's active pipeline
 * GET   /pipelines/{id}              current state of a pipeline
 * PUT   /pipelines/{id}/definition   regenerate: store a new definition version
 * PATCH /pipelines/{id}/deployment   update deployment parameters
 * GET   /pipelines/{id}/versions     definition history, newest first
 * POST  /pipelines/{id}/test         dry run in local sandboxes (blocks until done)
 * POST  /pipelines/{id}/trigger      start a run on the remote CI backend
 * GET   /pipelines/{id}/executions   run history, newest first
 */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final PipelineService  pipelineService;
    private final ExecutionService executionService;
    private final DryRunService    dryRunService;

    public PipelineController(PipelineService pipelineService,
                              ExecutionService executionService,
                              DryRunService dryRunService) {
        this.pipelineService  = pipelineService;
        this.executionService = executionService;
        this.dryRunService    = dryRunService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/pipelines \
     *     -H "Content-Type: application/json" \
     *     -d '{"repositoryKey":"acme/shop","remoteWorkspace":"acme","remoteRepoSlug":"shop",
     *          "definitionYaml":"pipelines:\n  default:\n    - step:\n        script: [make test]\n"}'
     */
    @PostMapping
    public ResponseEntity<PipelineResponse> create(@RequestBody CreatePipelineRequest req) {
        requireText(req.repositoryKey(),   "repositoryKey");
        requireText(req.remoteWorkspace(), "remoteWorkspace");
        requireText(req.remoteRepoSlug(),  "remoteRepoSlug");
        requireText(req.definitionYaml(),  "definitionYaml");
        Pipeline pipeline = pipelineService.create(req.toNewPipeline());
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(pipeline));
    }

    @GetMapping("/{id}")
    public PipelineResponse get(@PathVariable UUID id) {
        return PipelineResponse.from(pipelineService.get(id));
    }

    @PutMapping("/{id}/definition")
    public PipelineResponse regenerate(@PathVariable UUID id, @RequestBody RegenerateRequest req) {
        requireText(req.definitionYaml(), "definitionYaml");
        return PipelineResponse.from(pipelineService.regenerate(id, req.definitionYaml()));
    }

    @PatchMapping("/{id}/deployment")
    public PipelineResponse updateDeployment(@PathVariable UUID id, @RequestBody DeploymentUpdateRequest req) {
        return PipelineResponse.from(pipelineService.updateDeployment(id, req.toUpdate()));
    }

    @GetMapping("/{id}/versions")
    public List<PipelineVersionResponse> versions(@PathVariable UUID id) {
        return pipelineService.versions(id).stream()
                .map(PipelineVersionResponse::from)
                .toList();
    }

    /**
     * Run the current definition step by step in fresh sandboxes.
     * HTTP 200 with success=false when a step fails; 422 when the definition is invalid.
     */
    @PostMapping("/{id}/test")
    public DryRunResponse test(@PathVariable UUID id) {
        return DryRunResponse.from(dryRunService.test(id));
    }

    /**
     * HTTP 201: the remote run was started (and is being monitored unless monitor=false)
     * HTTP 502: every trigger attempt failed; the body carries the attempt count and
     *            the id of the FAILED run that records it
     */
    @PostMapping("/{id}/trigger")
    public ResponseEntity<ExecutionResponse> trigger(@PathVariable UUID id,
                                                     @RequestBody(required = false) TriggerPipelineRequest req) {
        TriggerPipelineRequest request = req != null ? req : TriggerPipelineRequest.empty();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExecutionResponse.from(executionService.trigger(id, request.toCommand())));
    }

    @GetMapping("/{id}/executions")
    public List<ExecutionResponse> executions(@PathVariable UUID id) {
        return executionService.history(id).stream()
                .map(ExecutionResponse::from)
                .toList();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }
}
