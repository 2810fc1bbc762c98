package com.deploypilot.engine.monitor;

import java.time.Duration;

/**
 * Poll loop tuning, bound from {@code deploypilot.monitor.*}.
 *
 * @param interval                  wait between two fetches
 * @param maxIterations             fetches before the loop gives up with a poll timeout
 * @param maxConsecutiveFetchErrors failed fetches in a row that stop the loop (1 = first failure)
 * @param leaseTtl                  lifetime of the per-run poll lease; renewed every iteration
 * @param logPreviewChars           characters of step log carried in a log update
 * @param maxConcurrentPollers      size of the poller thread pool
 */
public record MonitorSettings(
        Duration interval,
        int      maxIterations,
        int      maxConsecutiveFetchErrors,
        Duration leaseTtl,
        int      logPreviewChars,
        int      maxConcurrentPollers
) {
    public MonitorSettings {
        if (maxIterations < 1)             throw new IllegalArgumentException("maxIterations must be >= 1");
        if (maxConsecutiveFetchErrors < 1) throw new IllegalArgumentException("maxConsecutiveFetchErrors must be >= 1");
        if (maxConcurrentPollers < 1)      throw new IllegalArgumentException("maxConcurrentPollers must be >= 1");
        if (leaseTtl.compareTo(interval) <= 0) {
            throw new IllegalArgumentException("leaseTtl must be longer than the poll interval");
        }
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(Duration.ofSeconds(5), 120, 1, Duration.ofMinutes(2), 500, 16);
    }
}
