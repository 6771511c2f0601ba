package com.eyelevel.watermarks.scheduler;

import com.eyelevel.watermarks.config.JobQueueConfig;
import com.eyelevel.watermarks.service.queue.JobQueueManager;
import com.eyelevel.watermarks.service.status.JobStatusTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reclaims jobs whose results are no longer needed, and status records past their retention.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredJobCleanupScheduler {

    private final JobQueueManager queueManager;
    private final JobStatusTracker statusTracker;
    private final JobQueueConfig queueConfig;

    /**
     * Removes finished jobs past their download window, downloaded jobs and old failures, with
     * their files.
     */
    @Scheduled(fixedDelayString = "${app.scheduler.sweep-interval-ms:30000}",
            initialDelayString = "${app.scheduler.sweep-interval-ms:30000}")
    public void sweepExpiredJobs() {
        try {
            List<String> removed = queueManager.sweepExpired();
            if (removed.isEmpty()) {
                log.debug("Expiry sweep found nothing to reclaim.");
                return;
            }
            log.info("Expiry sweep reclaimed {} jobs: {}", removed.size(), removed);
        } catch (Exception e) {
            log.error("Expiry sweep failed. It will run again on the next schedule.", e);
        }
    }

    @Scheduled(fixedDelayString = "${app.scheduler.status-prune-interval-ms:600000}",
            initialDelayString = "${app.scheduler.status-prune-interval-ms:600000}")
    public void pruneOldStatuses() {
        try {
            int removed = statusTracker.pruneOlderThan(queueConfig.getLifecycle().getStatusRetention());
            log.debug("Status retention run removed {} records.", removed);
        } catch (Exception e) {
            log.error("Status retention run failed.", e);
        }
    }
}
