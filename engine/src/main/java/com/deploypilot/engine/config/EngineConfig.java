package com.deploypilot.engine.config;

import com.deploypilot.engine.monitor.MonitorSettings;
import com.deploypilot.engine.retry.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans that tests replace: the clock, the blocking sleeper
 * used by the retry and poll loops, and the poll loop settings.
 */
@Configuration
public class EngineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    MonitorSettings monitorSettings(
            @Value("${deploypilot.monitor.interval:PT5S}") Duration interval,
            @Value("${deploypilot.monitor.max-iterations:120}") int maxIterations,
            @Value("${deploypilot.monitor.max-consecutive-fetch-errors:1}") int maxConsecutiveFetchErrors,
            @Value("${deploypilot.monitor.lease-ttl:PT2M}") Duration leaseTtl,
            @Value("${deploypilot.monitor.log-preview-chars:500}") int logPreviewChars,
            @Value("${deploypilot.monitor.max-concurrent-pollers:16}") int maxConcurrentPollers) {
        return new MonitorSettings(interval, maxIterations, maxConsecutiveFetchErrors,
                leaseTtl, logPreviewChars, maxConcurrentPollers);
    }
}
