package com.careinsight.careinsight.cleanup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs periodic staged-file cleanup based on cron expression in configuration.
 */
@Component
public class CleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private final StagingCleanupService stagingCleanupService;

    public CleanupScheduler(StagingCleanupService stagingCleanupService) {
        this.stagingCleanupService = stagingCleanupService;
    }

    @Scheduled(cron = "${import.cleanup.cron:" + CleanupProperties.DEFAULT_CRON + "}")
    public void scheduledCleanup() {
        CleanupModels.CleanupResult result = stagingCleanupService.runConfiguredCleanup();
        log.info("Staged file cleanup complete. deleted={}, freedMb={}, remaining={}",
                result.totalDeleted(), result.totalFreedMb(), result.after().totalFiles());
    }
}
