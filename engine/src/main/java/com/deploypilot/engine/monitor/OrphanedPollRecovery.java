package com.deploypilot.engine.monitor;

import com.deploypilot.engine.service.ExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resumes polling of live remote runs whose poller died with its instance.
 *
 * Such runs still carry a poll lease that was never released; once it has
 * expired this instance picks the run up. The lease claim inside the poller
 * keeps two instances from resuming the same run.
 */
@Component
@EnableScheduling
public class OrphanedPollRecovery {

    private static final Logger log = LoggerFactory.getLogger(OrphanedPollRecovery.class);

    private final ExecutionService executionService;
    private final PollerRegistry   registry;

    public OrphanedPollRecovery(ExecutionService executionService, PollerRegistry registry) {
        this.executionService = executionService;
        this.registry         = registry;
    }

    @Scheduled(fixedDelayString = "${deploypilot.monitor.recovery-interval:PT1M}",
               initialDelayString = "${deploypilot.monitor.recovery-interval:PT1M}")
    public void resumeOrphanedPolls() {
        try {
            for (UUID runId : executionService.orphanedRuns()) {
                if (registry.start(runId) == PollerRegistry.StartResult.STARTED) {
                    log.warn("Resumed polling of orphaned execution {}", runId);
                }
            }
        } catch (RuntimeException e) {
            log.error("Orphaned poll recovery failed: {}", e.getMessage(), e);
        }
    }
}
