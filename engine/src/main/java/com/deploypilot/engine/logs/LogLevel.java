package com.deploypilot.engine.logs;

import java.util.List;
import java.util.Locale;

/**
 * Severity buckets for transcript lines. Transcripts carry no structured
 * level, so a line belongs to a level when it contains one of its keywords
 * (case-insensitive).
 */
public enum LogLevel {
    ERROR(List.of("error", "err", "exception", "fatal", "fail")),
    WARN(List.of("warn", "warning")),
    INFO(List.of("info")),
    DEBUG(List.of("debug", "trace"));

    private final List<String> keywords;

    LogLevel(List<String> keywords) {
        this.keywords = keywords;
    }

    public boolean matches(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    /** Case-insensitive lookup. */
    public static LogLevel parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level '" + value + "', expected one of ERROR, WARN, INFO, DEBUG", e);
        }
    }
}
