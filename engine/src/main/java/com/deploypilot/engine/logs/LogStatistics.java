package com.deploypilot.engine.logs;

import java.util.List;

/** Line counts of a transcript, plus the step names found in its headers. */
public record LogStatistics(
        int          totalLines,
        int          totalCharacters,
        int          errorLines,
        int          warningLines,
        int          infoLines,
        int          emptyLines,
        List<String> stepNames
) {
    public LogStatistics {
        stepNames = List.copyOf(stepNames);
    }

    public static LogStatistics empty() {
        return new LogStatistics(0, 0, 0, 0, 0, 0, List.of());
    }
}
