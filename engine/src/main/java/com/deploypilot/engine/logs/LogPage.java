package com.deploypilot.engine.logs;

import java.util.List;

/**
 * One page of transcript lines.
 *
 * @param startLine 1-based number of the first line on the page (0 when empty)
 * @param endLine   1-based number of the last line on the page (0 when empty)
 */
public record LogPage(
        List<String> lines,
        int          page,
        int          perPage,
        int          totalLines,
        int          totalPages,
        int          startLine,
        int          endLine
) {
    public LogPage {
        lines = List.copyOf(lines);
    }

    public boolean hasNext()     { return page < totalPages; }
    public boolean hasPrevious() { return page > 1; }
}
