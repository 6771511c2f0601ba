package com.eyelevel.watermarks.service.status;

import com.eyelevel.watermarks.model.JobStatus;
import com.eyelevel.watermarks.model.ProcessingStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Thread-safe, in-memory registry of per-job progress. Records are created at upload time and
 * removed on cleanup or by the retention sweep; nothing is persisted across restarts.
 * <p>
 * Every operation is serialized by a single lock. Callers only ever receive immutable
 * {@link JobStatus} snapshots.
 */
@Slf4j
@Service
public class JobStatusTracker {

    private final Map<String, JobStatus> statuses = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public JobStatusTracker(final Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a job in the {@code uploading} stage with zero progress, replacing any previous
     * record with the same id.
     *
     * @param jobId          The job identifier.
     * @param initialMessage The first message shown to the client.
     * @return The created status.
     */
    public JobStatus create(final String jobId, final String initialMessage) {
        lock.lock();
        try {
            Instant now = clock.instant();
            JobStatus status = JobStatus.builder()
                                        .jobId(jobId)
                                        .stage(ProcessingStage.UPLOADING)
                                        .progress(0)
                                        .message(initialMessage)
                                        .createdAt(now)
                                        .updatedAt(now)
                                        .build();
            statuses.put(jobId, status);
            log.debug("[JobId: {}] Status record created.", jobId);
            return status;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a partial update. A stage change assigns that stage's automatic progress; an explicit
     * progress value is clamped into {@code [0, 100]} and wins over the automatic one; an error forces
     * the {@code error} stage with zero progress regardless of anything else in the update.
     *
     * @param jobId  The job identifier.
     * @param update The fields to change.
     * @return The updated status, or empty if the job is unknown.
     */
    public Optional<JobStatus> update(final String jobId, final JobStatusUpdate update) {
        lock.lock();
        try {
            JobStatus current = statuses.get(jobId);
            if (current == null) {
                log.debug("[JobId: {}] Ignoring status update for an unknown job.", jobId);
                return Optional.empty();
            }

            JobStatus.JobStatusBuilder next = current.toBuilder();
            if (update.getStage() != null) {
                next.stage(update.getStage()).progress(update.getStage().getAutomaticProgress());
            }
            if (update.getProgress() != null) {
                next.progress(Math.max(0, Math.min(100, update.getProgress())));
            }
            if (update.getMessage() != null) {
                next.message(update.getMessage());
            }
            if (update.getResultPath() != null) {
                next.resultPath(update.getResultPath());
            }
            if (update.getError() != null) {
                next.error(update.getError()).stage(ProcessingStage.ERROR).progress(0);
            }
            JobStatus updated = next.updatedAt(clock.instant()).build();
            statuses.put(jobId, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobStatus> get(final String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(statuses.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(final String jobId) {
        lock.lock();
        try {
            return statuses.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if a record was removed.
     */
    public boolean delete(final String jobId) {
        lock.lock();
        try {
            return statuses.remove(jobId) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts jobs in a non-terminal stage (uploading, splitting, transforming or merging).
     */
    public int countActive() {
        lock.lock();
        try {
            return (int) statuses.values().stream().filter(status -> status.getStage().isActive()).count();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of jobs the pipeline is currently working on. {@code uploading} is excluded because an
     * upload has not been handed to the pipeline yet.
     */
    public Set<String> pipelineActiveJobIds() {
        lock.lock();
        try {
            return statuses.values().stream()
                           .filter(status -> status.getStage().isActive()
                                             && status.getStage() != ProcessingStage.UPLOADING)
                           .map(JobStatus::getJobId)
                           .collect(Collectors.toSet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every record created more than {@code maxAge} ago.
     *
     * @param maxAge The retention period.
     * @return The number of records removed.
     */
    public int pruneOlderThan(final Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        lock.lock();
        try {
            List<String> expired = statuses.values().stream()
                                           .filter(status -> status.getCreatedAt().isBefore(cutoff))
                                           .map(JobStatus::getJobId)
                                           .toList();
            expired.forEach(statuses::remove);
            if (!expired.isEmpty()) {
                log.info("Pruned {} status records created before {}.", expired.size(), cutoff);
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return All records ordered by creation time, for the admin listing.
     */
    public Map<String, JobStatus> getAll() {
        lock.lock();
        try {
            return statuses.values().stream()
                           .sorted(Comparator.comparing(JobStatus::getCreatedAt))
                           .collect(Collectors.toMap(JobStatus::getJobId, status -> status, (a, b) -> a,
                                                     LinkedHashMap::new));
        } finally {
            lock.unlock();
        }
    }
}
