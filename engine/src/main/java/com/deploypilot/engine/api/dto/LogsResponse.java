package com.deploypilot.engine.api.dto;

import com.deploypilot.engine.logs.LogPage;
import com.deploypilot.engine.logs.LogStatistics;

import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /executions/{id}/logs: one page of the filtered
 * transcript plus statistics over the whole, unfiltered transcript.
 */
public record LogsResponse(
        UUID          executionId,
        List<String>  lines,
        int           page,
        int           perPage,
        int           totalLines,
        int           totalPages,
        boolean       hasNext,
        boolean       hasPrevious,
        LogStatistics statistics
) {
    public static LogsResponse of(UUID executionId, LogPage page, LogStatistics statistics) {
        return new LogsResponse(executionId, page.lines(), page.page(), page.perPage(),
                page.totalLines(), page.totalPages(), page.hasNext(), page.hasPrevious(), statistics);
    }
}
