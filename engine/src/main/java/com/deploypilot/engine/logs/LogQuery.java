package com.deploypilot.engine.logs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented search, filtering and paging over persisted run transcripts.
 */
public final class LogQuery {

    public static final int DEFAULT_PER_PAGE = 100;
    public static final int MAX_PER_PAGE     = 1000;

    private LogQuery() {}

    public static List<String> lines(String transcript) {
        if (transcript == null || transcript.isEmpty()) return List.of();
        return Arrays.asList(transcript.split("\n", -1));
    }

    /** Lines containing {@code text}, ignoring case. Blank text keeps every line. */
    public static List<String> filterByText(List<String> lines, String text) {
        if (text == null || text.isBlank()) return lines;
        String needle = text.toLowerCase(Locale.ROOT);
        return lines.stream()
                .filter(line -> line.toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /** Lines matching the level's keywords. A null level keeps every line. */
    public static List<String> filterByLevel(List<String> lines, LogLevel level) {
        if (level == null) return lines;
        return lines.stream().filter(level::matches).toList();
    }

    /**
     * Cut one page out of {@code lines}. Out-of-range page numbers are
     * clamped to the first or last page.
     */
    public static LogPage paginate(List<String> lines, int page, int perPage) {
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new IllegalArgumentException("perPage must be between 1 and " + MAX_PER_PAGE);
        }
        int total = lines.size();
        int totalPages = (total + perPage - 1) / perPage;
        int current = Math.max(1, Math.min(page, Math.max(totalPages, 1)));

        int from = Math.min((current - 1) * perPage, total);
        int to   = Math.min(from + perPage, total);
        return new LogPage(lines.subList(from, to), current, perPage, total, totalPages,
                to == from ? 0 : from + 1, to);
    }

    public static LogStatistics statistics(String transcript) {
        if (transcript == null || transcript.isEmpty()) return LogStatistics.empty();

        List<String> lines = lines(transcript);
        int error = 0, warning = 0, info = 0, empty = 0;
        List<String> steps = new ArrayList<>();

        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                empty++;
                continue;
            }
            if (trimmed.startsWith("===") && trimmed.endsWith("===") && trimmed.length() > 6) {
                steps.add(trimmed.substring(3, trimmed.length() - 3).strip());
                continue;
            }
            if (LogLevel.ERROR.matches(line))     error++;
            else if (LogLevel.WARN.matches(line)) warning++;
            else if (LogLevel.INFO.matches(line)) info++;
        }
        return new LogStatistics(lines.size(), transcript.length(), error, warning, info, empty, steps);
    }
}
