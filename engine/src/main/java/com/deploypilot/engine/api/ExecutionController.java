package com.deploypilot.engine.api;

import com.deploypilot.engine.api.dto.ExecutionResponse;
import com.deploypilot.engine.api.dto.LogsResponse;
import com.deploypilot.engine.api.dto.MonitorResponse;
import com.deploypilot.engine.api.dto.RollbackRequest;
import com.deploypilot.engine.logs.LogLevel;
import com.deploypilot.engine.logs.LogQuery;
import com.deploypilot.engine.model.ExecutionRun;
import com.deploypilot.engine.monitor.PollerRegistry;
import com.deploypilot.engine.service.ExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for execution runs.
 *
 * GET    /executions/{id}            current state of a run
 * GET    /executions/{id}/logs       filtered, paginated transcript
 * POST   /executions/{id}/monitor    (re)start the status poller
 * DELETE /executions/{id}/monitor    stop the status poller
 * POST   /executions/{id}/rollback   re-deploy the last good commit before this run
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final ExecutionService executionService;
    private final PollerRegistry   pollerRegistry;

    public ExecutionController(ExecutionService executionService, PollerRegistry pollerRegistry) {
        this.executionService = executionService;
        this.pollerRegistry   = pollerRegistry;
    }

    @GetMapping("/{id}")
    public ExecutionResponse get(@PathVariable UUID id) {
        return ExecutionResponse.from(executionService.get(id));
    }

    /**
     * Example:
     *   curl 'http://localhost:8080/executions/{id}/logs?level=error&page=1&perPage=50'
     */
    @GetMapping("/{id}/logs")
    public LogsResponse logs(@PathVariable UUID id,
                             @RequestParam(required = false) String search,
                             @RequestParam(required = false) String level,
                             @RequestParam(defaultValue = "1") int page,
                             @RequestParam(defaultValue = "100") int perPage) {
        ExecutionRun run = executionService.get(id);

        LogLevel logLevel;
        try {
            logLevel = level == null || level.isBlank() ? null : LogLevel.parse(level);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        List<String> lines = LogQuery.lines(run.getLogs());
        lines = LogQuery.filterByText(lines, search);
        lines = LogQuery.filterByLevel(lines, logLevel);
        return LogsResponse.of(id, LogQuery.paginate(lines, page, perPage),
                LogQuery.statistics(run.getLogs()));
    }

    /**
     * HTTP 202: poller started, or one is already running for this run
     * HTTP 409: the run is terminal, local, or has no remote id
     */
    @PostMapping("/{id}/monitor")
    public ResponseEntity<MonitorResponse> startMonitor(@PathVariable UUID id) {
        executionService.get(id);
        PollerRegistry.StartResult result = pollerRegistry.start(id);
        if (result == PollerRegistry.StartResult.NOT_POLLABLE) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new MonitorResponse(id, false, result.name()));
        }
        return ResponseEntity.accepted().body(new MonitorResponse(id, true, result.name()));
    }

    @DeleteMapping("/{id}/monitor")
    public MonitorResponse stopMonitor(@PathVariable UUID id) {
        executionService.get(id);
        boolean cancelled = pollerRegistry.cancel(id);
        return new MonitorResponse(id, false, cancelled ? "CANCELLED" : "NOT_POLLING");
    }

    @PostMapping("/{id}/rollback")
    public ResponseEntity<ExecutionResponse> rollback(@PathVariable UUID id,
                                                      @RequestBody(required = false) RollbackRequest req) {
        RollbackRequest request = req != null ? req : RollbackRequest.empty();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExecutionResponse.from(executionService.rollback(id, request.toCommand())));
    }
}
